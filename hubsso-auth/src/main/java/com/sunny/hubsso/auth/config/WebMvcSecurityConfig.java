package com.sunny.hubsso.auth.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.sunny.hubsso.auth.security.SessionAuthInterceptor;
/**
 * WebMvc安全配置
 * 为受保护的 /api 接口挂载会话校验拦截器
 *
 * @author Sunny
 * @date 2026-10-17
 */

@Configuration
public class WebMvcSecurityConfig implements WebMvcConfigurer {

    private final SessionAuthInterceptor sessionAuthInterceptor;

    public WebMvcSecurityConfig(SessionAuthInterceptor sessionAuthInterceptor) {
        this.sessionAuthInterceptor = sessionAuthInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(sessionAuthInterceptor)
                .addPathPatterns("/api/**");
    }
}
