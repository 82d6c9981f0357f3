package com.sunny.hubsso.auth.security;

import java.util.Optional;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 认证CookieManager组件
 * 负责会话Cookie的写入、读取与清除
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Component
@RequiredArgsConstructor
public class AuthCookieManager {

    private final AuthSecurityProperties securityProperties;

    public SessionStore sessionStore(HttpServletRequest request, HttpServletResponse response) {
        return new CookieSessionStore(this, request, response);
    }

    public void setSessionCookie(HttpServletResponse response, String token) {
        long maxAge = securityProperties.getToken().getSessionLifetime().getSeconds();
        addCookieHeader(response, buildCookie(token, maxAge));
    }

    public void clearSessionCookie(HttpServletResponse response) {
        addCookieHeader(response, buildCookie("", 0));
    }

    public Optional<String> readSessionCookie(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, securityProperties.getCookie().getName());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private ResponseCookie buildCookie(String value, long maxAge) {
        return ResponseCookie.from(securityProperties.getCookie().getName(), value)
                .httpOnly(true)
                .secure(securityProperties.getCookie().isSecure())
                .path("/")
                .maxAge(maxAge)
                .sameSite("Lax")
                .build();
    }

    private void addCookieHeader(HttpServletResponse response, ResponseCookie cookie) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
