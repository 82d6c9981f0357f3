package com.sunny.hubsso.auth.model;

import java.util.List;
import java.util.Objects;

/**
 * 身份快照
 * 由用户记录与其角色名组成，认证核心只读
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record Identity(
        long id,
        String email,
        long hubId,
        String displayName,
        String passwordHash,
        List<String> roles) {

    public Identity {
        Objects.requireNonNull(email, "email");
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
