package com.sunny.hubsso.common.security;

/**
 * 会话Token中的声明字段名
 *
 * @author Sunny
 * @date 2026-10-17
 */
public final class SessionClaimNames {

    public static final String SUBJECT = "sub";
    public static final String EMAIL = "email";
    public static final String HUB_ID = "hub_id";
    public static final String NAME = "name";
    public static final String ROLES = "roles";
    public static final String EXPIRES_AT = "exp";

    private SessionClaimNames() {
    }
}
