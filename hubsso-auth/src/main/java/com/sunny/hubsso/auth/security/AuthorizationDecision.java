package com.sunny.hubsso.auth.security;

import java.util.Map;
import java.util.Objects;

import com.sunny.hubsso.common.exception.ForbiddenException;

/**
 * 授权判定结果
 * 拒绝时携带原因，只有 {@link #orThrow()} 会抛出异常
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record AuthorizationDecision(boolean allowed, DenyReason reason) {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null);

    public AuthorizationDecision {
        if (!allowed) {
            Objects.requireNonNull(reason, "reason");
        }
    }

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(false, reason);
    }

    public AuthorizationDecision orThrow() {
        if (!allowed) {
            throw new ForbiddenException(reason.getErrorType(), Map.of("reason", reason.name()), reason.getMessage());
        }
        return this;
    }
}
