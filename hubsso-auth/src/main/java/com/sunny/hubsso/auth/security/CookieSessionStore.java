package com.sunny.hubsso.auth.security;

import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 基于会话Cookie的 {@link SessionStore}，生命周期为单个请求
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class CookieSessionStore implements SessionStore {

    private final AuthCookieManager cookieManager;
    private final HttpServletRequest request;
    private final HttpServletResponse response;

    CookieSessionStore(AuthCookieManager cookieManager, HttpServletRequest request, HttpServletResponse response) {
        this.cookieManager = cookieManager;
        this.request = request;
        this.response = response;
    }

    @Override
    public void store(String token) {
        cookieManager.setSessionCookie(response, token);
    }

    @Override
    public Optional<String> load() {
        return cookieManager.readSessionCookie(request);
    }

    @Override
    public void clear() {
        cookieManager.clearSessionCookie(response);
    }
}
