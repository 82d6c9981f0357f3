package com.sunny.hubsso.auth.security;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.common.security.SessionClaims;

import lombok.RequiredArgsConstructor;

/**
 * 会话声明构建组件
 * 由身份快照生成声明，过期时间取当前时刻加有效期
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Component
@RequiredArgsConstructor
public class ClaimsBuilder {

    private final Clock clock;

    public SessionClaims build(Identity identity, Duration lifetime) {
        long expiresAt = clock.instant().plus(lifetime).getEpochSecond();
        return new SessionClaims(
                String.valueOf(identity.id()),
                identity.email().toLowerCase(Locale.ROOT),
                identity.hubId(),
                identity.displayName(),
                identity.roles(),
                expiresAt);
    }
}
