package com.sunny.hubsso.common.constant;

/**
 * 统一错误码常量
 * 全项目仅允许使用该集合中的状态码
 *
 * @author Sunny
 * @date 2026-10-17
 */
public final class Code {

    public static final int OK = 0;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_ERROR = 500;

    private Code() {
    }
}
