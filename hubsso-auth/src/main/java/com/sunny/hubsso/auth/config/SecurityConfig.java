package com.sunny.hubsso.auth.config;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

import com.sunny.hubsso.common.security.TokenCodec;

/**
 * 安全配置
 * 负责密码编码器、Token编解码器与过滤链装配
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Configuration
@EnableWebSecurity
@EnableConfigurationProperties(AuthSecurityProperties.class)
public class SecurityConfig {

    private static final int BCRYPT_STRENGTH = 12;

    private final AuthSecurityProperties securityProperties;

    public SecurityConfig(AuthSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(Clock clock) {
        String secret = securityProperties.getToken().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < TokenCodec.MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "security.token.secret 未配置或长度少于" + TokenCodec.MIN_SECRET_BYTES + "字节");
        }
        return new TokenCodec(clock);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                // 会话由签名Cookie承载，CSRF 依赖 SameSite=Lax
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                // 会话校验在 SessionAuthInterceptor 中完成
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/auth/**", "/api/**").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .anyRequest().denyAll()
                );

        return http.build();
    }
}
