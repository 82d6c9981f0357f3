package com.sunny.hubsso.auth.security;

/**
 * 策略的Hub作用域
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record HubScope(Kind kind, long hubId) {

    public enum Kind {
        ANY,
        OWN,
        SPECIFIC
    }

    public static final HubScope ANY = new HubScope(Kind.ANY, 0L);
    public static final HubScope OWN = new HubScope(Kind.OWN, 0L);

    public static HubScope specific(long hubId) {
        return new HubScope(Kind.SPECIFIC, hubId);
    }
}
