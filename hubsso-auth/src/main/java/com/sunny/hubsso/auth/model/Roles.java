package com.sunny.hubsso.auth.model;

/**
 * 内置角色常量
 *
 * @author Sunny
 * @date 2026-10-17
 */
public final class Roles {

    /**
     * 系统保留的管理员角色，不可删除
     */
    public static final long ADMIN_ROLE_ID = 1L;
    public static final String ADMIN = "admin";

    private Roles() {
    }
}
