package com.sunny.hubsso.auth.security;

import com.sunny.hubsso.common.constant.ErrorType;

/**
 * 拒绝原因
 *
 * @author Sunny
 * @date 2026-10-17
 */
public enum DenyReason {

    MISSING_ROLE(ErrorType.MISSING_ROLE, "缺少所需角色"),
    WRONG_HUB(ErrorType.WRONG_HUB, "无权访问该Hub的资源"),
    SELF_ACTION_FORBIDDEN(ErrorType.SELF_ACTION_FORBIDDEN, "不允许对自身或受保护资源执行该操作");

    private final String errorType;
    private final String message;

    DenyReason(String errorType, String message) {
        this.errorType = errorType;
        this.message = message;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }
}
