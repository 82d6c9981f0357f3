package com.sunny.hubsso.auth.security;

import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import com.sunny.hubsso.auth.service.LoginService;
import com.sunny.hubsso.common.security.SessionClaims;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 会话校验拦截器
 * 校验会话Token且用户仍存在，通过后将声明写入请求属性
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Component
@RequiredArgsConstructor
public class SessionAuthInterceptor implements HandlerInterceptor {

    public static final String CLAIMS_ATTRIBUTE = "hubsso.claims";

    private final AuthCookieManager authCookieManager;
    private final LoginService loginService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        SessionStore sessionStore = authCookieManager.sessionStore(request, response);
        SessionClaims claims = loginService.currentClaims(sessionStore);
        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
        return true;
    }
}
