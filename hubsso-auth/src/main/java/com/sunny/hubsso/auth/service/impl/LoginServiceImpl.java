package com.sunny.hubsso.auth.service.impl;

import java.util.Locale;

import org.springframework.stereotype.Service;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;
import com.sunny.hubsso.auth.exception.InvalidCredentialsException;
import com.sunny.hubsso.auth.exception.UnauthenticatedException;
import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.auth.repository.IdentityRepository;
import com.sunny.hubsso.auth.security.ClaimsBuilder;
import com.sunny.hubsso.auth.security.LoginAttemptTracker;
import com.sunny.hubsso.auth.security.PasswordVerifier;
import com.sunny.hubsso.auth.security.SessionStore;
import com.sunny.hubsso.auth.service.LoginCommand;
import com.sunny.hubsso.auth.service.LoginResult;
import com.sunny.hubsso.auth.service.LoginService;
import com.sunny.hubsso.common.exception.TokenRejectedException;
import com.sunny.hubsso.common.security.SessionClaims;
import com.sunny.hubsso.common.security.TokenCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 登录服务实现
 * 实现登录业务流程与规则处理
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginServiceImpl implements LoginService {

    private final IdentityRepository identityRepository;
    private final PasswordVerifier passwordVerifier;
    private final ClaimsBuilder claimsBuilder;
    private final TokenCodec tokenCodec;
    private final LoginAttemptTracker loginAttemptTracker;
    private final AuthSecurityProperties securityProperties;

    @Override
    public LoginResult login(LoginCommand command, SessionStore sessionStore) {
        String email = normalizeEmail(command.getEmail());
        Long hubId = command.getHubId();
        String clientIp = command.getClientIp();

        loginAttemptTracker.assertLoginAllowed(hubId, email, clientIp);

        Identity identity = hubId == null
                ? null
                : identityRepository.findByEmailAndHub(email, hubId).orElse(null);
        // 用户不存在与密码错误返回同一异常
        if (identity == null || !passwordVerifier.verify(command.getPassword(), identity.passwordHash())) {
            loginAttemptTracker.recordFailure(hubId, email, clientIp);
            log.warn("security_event event=login_failed hubId={} email={} clientIp={}", hubId, email, clientIp);
            throw new InvalidCredentialsException();
        }

        loginAttemptTracker.clearFailures(hubId, email, clientIp);
        LoginResult result = issueSession(identity, sessionStore);
        log.info("security_event event=login_success userId={} hubId={} clientIp={}",
                identity.id(), identity.hubId(), clientIp);
        return result;
    }

    @Override
    public LoginResult loginWithToken(String token, SessionStore sessionStore) {
        SessionClaims decoded;
        try {
            decoded = tokenCodec.decode(token, secret());
        } catch (TokenRejectedException e) {
            log.warn("security_event event=token_login_rejected reason={}", e.getReason());
            throw new InvalidCredentialsException(e);
        }

        Identity identity = identityRepository.findByEmailAndHub(normalizeEmail(decoded.email()), decoded.hubId())
                .filter(found -> String.valueOf(found.id()).equals(decoded.subject()))
                .orElse(null);
        if (identity == null) {
            log.warn("security_event event=token_login_rejected reason=IDENTITY_GONE userId={} hubId={}",
                    decoded.subject(), decoded.hubId());
            throw new InvalidCredentialsException();
        }

        LoginResult result = issueSession(identity, sessionStore);
        log.info("security_event event=token_login_success userId={} hubId={}", identity.id(), identity.hubId());
        return result;
    }

    @Override
    public void logout(SessionStore sessionStore) {
        sessionStore.clear();
        log.info("security_event event=logout");
    }

    @Override
    public SessionClaims currentClaims(SessionStore sessionStore) {
        String token = sessionStore.load()
                .orElseThrow(() -> new UnauthenticatedException("未登录或登录已过期"));

        SessionClaims claims;
        try {
            claims = tokenCodec.decode(token, secret());
        } catch (TokenRejectedException e) {
            log.debug("会话Token校验失败: reason={}", e.getReason());
            throw new UnauthenticatedException(e, "未登录或登录已过期");
        }

        long userId;
        try {
            userId = Long.parseLong(claims.subject());
        } catch (NumberFormatException e) {
            throw new UnauthenticatedException(e, "未登录或登录已过期");
        }
        if (identityRepository.findById(userId).isEmpty()) {
            log.warn("security_event event=session_user_missing userId={} hubId={}", userId, claims.hubId());
            throw new UnauthenticatedException("用户不存在");
        }
        return claims;
    }

    private LoginResult issueSession(Identity identity, SessionStore sessionStore) {
        SessionClaims claims = claimsBuilder.build(identity, securityProperties.getToken().getSessionLifetime());
        String token = tokenCodec.encode(claims, secret());
        sessionStore.store(token);
        return new LoginResult(claims, token);
    }

    private String secret() {
        return securityProperties.getToken().getSecret();
    }

    private String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
