package com.sunny.hubsso.common.security;

import com.sunny.hubsso.common.constant.ErrorType;

/**
 * Token拒绝原因
 *
 * @author Sunny
 * @date 2026-10-17
 */
public enum TokenRejectionReason {

    EXPIRED(ErrorType.TOKEN_EXPIRED, "Token已过期"),
    MALFORMED(ErrorType.TOKEN_MALFORMED, "Token格式错误"),
    BAD_SIGNATURE(ErrorType.TOKEN_BAD_SIGNATURE, "Token签名无效");

    private final String errorType;
    private final String message;

    TokenRejectionReason(String errorType, String message) {
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
