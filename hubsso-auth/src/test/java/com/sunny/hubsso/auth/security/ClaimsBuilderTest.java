package com.sunny.hubsso.auth.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.common.security.SessionClaims;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClaimsBuilderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ClaimsBuilder builder = new ClaimsBuilder(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void build_shouldCopyIdentityAndSetExpiry() {
        Identity identity = new Identity(7L, "Admin@Example.COM", 1L, "Admin", "hash", List.of("admin", "crm"));

        SessionClaims claims = builder.build(identity, Duration.ofDays(7));

        assertEquals("7", claims.subject());
        assertEquals("admin@example.com", claims.email());
        assertEquals(1L, claims.hubId());
        assertEquals("Admin", claims.name());
        assertEquals(List.of("admin", "crm"), claims.roles());
        assertEquals(NOW.getEpochSecond() + 7 * 24 * 3600, claims.expiresAt());
    }

    @Test
    void build_shouldUseEmptyNameWhenDisplayNameMissing() {
        Identity identity = new Identity(3L, "user@example.com", 2L, null, "hash", List.of());

        SessionClaims claims = builder.build(identity, Duration.ofDays(1));

        assertEquals("", claims.name());
        assertEquals(NOW.getEpochSecond() + 24 * 3600, claims.expiresAt());
    }
}
