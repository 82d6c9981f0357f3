package com.sunny.hubsso.auth.security;

import java.util.Objects;

import com.sunny.hubsso.auth.model.Roles;

/**
 * 访问策略
 * requiredRole 为空表示仅要求已登录
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record AccessPolicy(String requiredRole, HubScope scope) {

    public static final AccessPolicy ADMIN_GLOBAL = new AccessPolicy(Roles.ADMIN, HubScope.ANY);
    public static final AccessPolicy ADMIN_OWN_HUB = new AccessPolicy(Roles.ADMIN, HubScope.OWN);
    public static final AccessPolicy AUTHENTICATED_OWN_HUB = new AccessPolicy(null, HubScope.OWN);

    public AccessPolicy {
        Objects.requireNonNull(scope, "scope");
    }

    public static AccessPolicy requireRole(String role, HubScope scope) {
        return new AccessPolicy(Objects.requireNonNull(role, "role"), scope);
    }
}
