package com.sunny.hubsso.auth.service;

import com.sunny.hubsso.common.security.SessionClaims;

/**
 * 登录结果，token 已绑定到会话载体
 */
public record LoginResult(SessionClaims claims, String token) {
}
