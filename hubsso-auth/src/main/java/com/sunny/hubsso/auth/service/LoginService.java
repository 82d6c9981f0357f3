package com.sunny.hubsso.auth.service;

import com.sunny.hubsso.auth.security.SessionStore;
import com.sunny.hubsso.common.security.SessionClaims;

/**
 * 登录服务
 * 负责会话的签发、重签、注销与校验
 *
 * @author Sunny
 * @date 2026-10-17
 */
public interface LoginService {

    /**
     * 邮箱密码登录
     */
    LoginResult login(LoginCommand command, SessionStore sessionStore);

    /**
     * 使用已签发的Token（如找回链接）重新登录，签发新的会话Token
     */
    LoginResult loginWithToken(String token, SessionStore sessionStore);

    void logout(SessionStore sessionStore);

    /**
     * 校验当前会话并确认用户仍存在
     */
    SessionClaims currentClaims(SessionStore sessionStore);
}
