package com.sunny.hubsso.common.security;

import java.util.List;
import java.util.Objects;

/**
 * 会话声明
 * 会话Token承载的身份快照，expiresAt 为 epoch 秒
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record SessionClaims(
        String subject,
        String email,
        long hubId,
        String name,
        List<String> roles,
        long expiresAt) {

    public SessionClaims {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(email, "email");
        name = name == null ? "" : name;
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }
}
