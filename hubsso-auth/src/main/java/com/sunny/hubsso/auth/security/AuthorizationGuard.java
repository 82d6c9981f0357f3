package com.sunny.hubsso.auth.security;

import org.springframework.stereotype.Component;

import com.sunny.hubsso.auth.model.Roles;
import com.sunny.hubsso.common.security.SessionClaims;

import lombok.extern.slf4j.Slf4j;

/**
 * 授权守卫组件
 * 基于角色与Hub作用域判定访问，删除类操作额外做自我保护
 *
 * <p>判定顺序：</p>
 * <ol>
 *   <li>要求角色不在声明中：MISSING_ROLE</li>
 *   <li>OWN 作用域且资源Hub与声明Hub不同：WRONG_HUB</li>
 *   <li>SPECIFIC 作用域、Hub不同且调用方非管理员：WRONG_HUB</li>
 * </ol>
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Slf4j
@Component
public class AuthorizationGuard {

    public AuthorizationDecision authorize(SessionClaims claims, AccessPolicy policy, long resourceHubId) {
        String requiredRole = policy.requiredRole();
        if (requiredRole != null && !claims.hasRole(requiredRole)) {
            return deny(claims, DenyReason.MISSING_ROLE, resourceHubId);
        }

        HubScope scope = policy.scope();
        switch (scope.kind()) {
            case OWN -> {
                if (resourceHubId != claims.hubId()) {
                    return deny(claims, DenyReason.WRONG_HUB, resourceHubId);
                }
            }
            case SPECIFIC -> {
                if (claims.hubId() != scope.hubId() && !claims.hasRole(Roles.ADMIN)) {
                    return deny(claims, DenyReason.WRONG_HUB, resourceHubId);
                }
            }
            case ANY -> {
                // 全局资源不校验Hub
            }
        }
        return AuthorizationDecision.allow();
    }

    /**
     * 自我删除对任何调用方都先于角色校验拒绝
     */
    public AuthorizationDecision authorizeUserDeletion(SessionClaims claims, long targetUserId, long targetHubId) {
        if (String.valueOf(targetUserId).equals(claims.subject())) {
            return deny(claims, DenyReason.SELF_ACTION_FORBIDDEN, targetHubId);
        }
        return authorize(claims, AccessPolicy.ADMIN_OWN_HUB, targetHubId);
    }

    public AuthorizationDecision authorizeHubDeletion(SessionClaims claims, long hubId) {
        if (hubId == claims.hubId()) {
            return deny(claims, DenyReason.SELF_ACTION_FORBIDDEN, hubId);
        }
        return authorize(claims, AccessPolicy.ADMIN_GLOBAL, hubId);
    }

    public AuthorizationDecision authorizeRoleDeletion(SessionClaims claims, long roleId) {
        if (roleId == Roles.ADMIN_ROLE_ID) {
            return deny(claims, DenyReason.SELF_ACTION_FORBIDDEN, claims.hubId());
        }
        return authorize(claims, AccessPolicy.ADMIN_GLOBAL, claims.hubId());
    }

    private AuthorizationDecision deny(SessionClaims claims, DenyReason reason, long resourceHubId) {
        log.warn("security_event event=access_denied reason={} userId={} hubId={} resourceHubId={}",
                reason, claims.subject(), claims.hubId(), resourceHubId);
        return AuthorizationDecision.deny(reason);
    }
}
