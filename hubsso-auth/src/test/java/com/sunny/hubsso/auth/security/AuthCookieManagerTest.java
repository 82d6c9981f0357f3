package com.sunny.hubsso.auth.security;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;

import jakarta.servlet.http.Cookie;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthCookieManagerTest {

    private final AuthSecurityProperties properties = new AuthSecurityProperties();
    private final AuthCookieManager cookieManager = new AuthCookieManager(properties);

    @Test
    void store_shouldWriteHttpOnlyLaxCookieForSessionLifetime() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        SessionStore store = cookieManager.sessionStore(new MockHttpServletRequest(), response);

        store.store("header.payload.signature");

        String header = response.getHeader(HttpHeaders.SET_COOKIE);
        assertTrue(header.startsWith("hub-session=header.payload.signature"));
        assertTrue(header.contains("Max-Age=604800"));
        assertTrue(header.contains("HttpOnly"));
        assertTrue(header.contains("SameSite=Lax"));
        assertTrue(header.contains("Path=/"));
        assertFalse(header.contains("Secure"));
    }

    @Test
    void clear_shouldExpireCookie() {
        properties.getCookie().setSecure(true);
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookieManager.sessionStore(new MockHttpServletRequest(), response).clear();

        String header = response.getHeader(HttpHeaders.SET_COOKIE);
        assertTrue(header.startsWith("hub-session=;"));
        assertTrue(header.contains("Max-Age=0"));
        assertTrue(header.contains("Secure"));
    }

    @Test
    void load_shouldReadSessionCookieOnly() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("other", "x"), new Cookie("hub-session", "tok"));

        assertEquals("tok", cookieManager.sessionStore(request, new MockHttpServletResponse()).load().orElseThrow());
        assertTrue(cookieManager.sessionStore(new MockHttpServletRequest(), new MockHttpServletResponse())
                .load().isEmpty());
    }
}
