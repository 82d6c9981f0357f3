package com.sunny.hubsso.auth.security;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.sunny.hubsso.common.constant.ErrorType;
import com.sunny.hubsso.common.exception.ForbiddenException;
import com.sunny.hubsso.common.security.SessionClaims;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthorizationGuardTest {

    private final AuthorizationGuard guard = new AuthorizationGuard();

    private SessionClaims claims(String subject, long hubId, String... roles) {
        return new SessionClaims(subject, "u" + subject + "@example.com", hubId, "User", List.of(roles), 4_000_000_000L);
    }

    @Test
    void authorize_shouldAllowAdminInOwnHub() {
        AuthorizationDecision decision = guard.authorize(claims("7", 1L, "admin"), AccessPolicy.ADMIN_OWN_HUB, 1L);

        assertTrue(decision.allowed());
    }

    @Test
    void authorize_shouldDenyMissingRole() {
        AuthorizationDecision decision = guard.authorize(claims("8", 1L, "crm"), AccessPolicy.ADMIN_OWN_HUB, 1L);

        assertFalse(decision.allowed());
        assertEquals(DenyReason.MISSING_ROLE, decision.reason());
    }

    @Test
    void authorize_shouldMatchRoleNamesExactly() {
        AuthorizationDecision decision = guard.authorize(claims("8", 1L, "Admin"), AccessPolicy.ADMIN_GLOBAL, 1L);

        assertEquals(DenyReason.MISSING_ROLE, decision.reason());
    }

    @Test
    void authorize_shouldCheckRoleBeforeHub() {
        AuthorizationDecision decision = guard.authorize(claims("8", 1L), AccessPolicy.ADMIN_OWN_HUB, 2L);

        assertEquals(DenyReason.MISSING_ROLE, decision.reason());
    }

    @Test
    void authorize_shouldDenyOtherHubForOwnScopeEvenForAdmin() {
        AuthorizationDecision decision = guard.authorize(claims("7", 1L, "admin"), AccessPolicy.ADMIN_OWN_HUB, 2L);

        assertEquals(DenyReason.WRONG_HUB, decision.reason());
    }

    @Test
    void authorize_shouldAllowAnyHubForGlobalScope() {
        assertTrue(guard.authorize(claims("7", 1L, "admin"), AccessPolicy.ADMIN_GLOBAL, 99L).allowed());
    }

    @Test
    void authorize_shouldLetAdminCrossSpecificHub() {
        AccessPolicy policy = new AccessPolicy(null, HubScope.specific(5L));

        assertTrue(guard.authorize(claims("7", 1L, "admin"), policy, 5L).allowed());
        assertTrue(guard.authorize(claims("9", 5L), policy, 5L).allowed());
        assertEquals(DenyReason.WRONG_HUB, guard.authorize(claims("9", 1L), policy, 5L).reason());
    }

    @Test
    void authorize_shouldRequireOnlyHubForAuthenticatedPolicy() {
        assertTrue(guard.authorize(claims("9", 3L), AccessPolicy.AUTHENTICATED_OWN_HUB, 3L).allowed());
        assertEquals(DenyReason.WRONG_HUB,
                guard.authorize(claims("9", 3L), AccessPolicy.AUTHENTICATED_OWN_HUB, 4L).reason());
    }

    @Test
    void authorizeUserDeletion_shouldForbidDeletingSelf() {
        SessionClaims admin = claims("7", 1L, "admin");

        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN, guard.authorizeUserDeletion(admin, 7L, 1L).reason());
        assertTrue(guard.authorizeUserDeletion(admin, 8L, 1L).allowed());
        assertEquals(DenyReason.WRONG_HUB, guard.authorizeUserDeletion(admin, 8L, 2L).reason());
    }

    @Test
    void authorizeUserDeletion_shouldReportSelfBeforeRoleAndHubChecks() {
        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN,
                guard.authorizeUserDeletion(claims("8", 1L, "crm"), 8L, 1L).reason());
        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN,
                guard.authorizeUserDeletion(claims("8", 1L), 8L, 2L).reason());
        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN,
                guard.authorizeUserDeletion(claims("7", 1L, "admin"), 7L, 2L).reason());
        assertEquals(DenyReason.MISSING_ROLE,
                guard.authorizeUserDeletion(claims("8", 1L, "crm"), 9L, 1L).reason());
    }

    @Test
    void authorizeHubDeletion_shouldReportSelfForNonAdminOwnHub() {
        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN, guard.authorizeHubDeletion(claims("8", 1L), 1L).reason());
    }

    @Test
    void authorizeHubDeletion_shouldForbidDeletingCurrentHub() {
        SessionClaims admin = claims("7", 1L, "admin");

        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN, guard.authorizeHubDeletion(admin, 1L).reason());
        assertTrue(guard.authorizeHubDeletion(admin, 2L).allowed());
        assertEquals(DenyReason.MISSING_ROLE, guard.authorizeHubDeletion(claims("8", 1L), 2L).reason());
    }

    @Test
    void authorizeRoleDeletion_shouldProtectAdminRoleForEveryone() {
        SessionClaims admin = claims("7", 1L, "admin");

        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN, guard.authorizeRoleDeletion(admin, 1L).reason());
        assertEquals(DenyReason.SELF_ACTION_FORBIDDEN, guard.authorizeRoleDeletion(claims("8", 1L), 1L).reason());
        assertTrue(guard.authorizeRoleDeletion(admin, 2L).allowed());
        assertEquals(DenyReason.MISSING_ROLE, guard.authorizeRoleDeletion(claims("8", 1L), 2L).reason());
    }

    @Test
    void orThrow_shouldRaiseForbiddenWithReasonType() {
        AuthorizationDecision decision = guard.authorize(claims("8", 1L), AccessPolicy.ADMIN_GLOBAL, 1L);

        ForbiddenException ex = assertThrows(ForbiddenException.class, decision::orThrow);

        assertEquals(403, ex.getCode());
        assertEquals(ErrorType.MISSING_ROLE, ex.getType());
    }

    @Test
    void authorize_shouldNotMutateClaims() {
        SessionClaims claims = claims("7", 1L, "admin");
        SessionClaims copy = claims("7", 1L, "admin");

        guard.authorize(claims, AccessPolicy.ADMIN_OWN_HUB, 2L);
        guard.authorizeUserDeletion(claims, 7L, 1L);

        assertEquals(copy, claims);
    }
}
