package com.sunny.hubsso.auth.model;

/**
 * Hub内身份列表查询条件
 * role 与 search 为空时不过滤，page 为空时返回全部
 *
 * @author Sunny
 * @date 2026-10-17
 */
public record IdentityQuery(long hubId, String role, String search, Integer page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;

    public IdentityQuery {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize必须大于0");
        }
    }

    public static IdentityQuery of(long hubId, String role, String search, Integer page) {
        return new IdentityQuery(hubId, role, search, page, DEFAULT_PAGE_SIZE);
    }
}
