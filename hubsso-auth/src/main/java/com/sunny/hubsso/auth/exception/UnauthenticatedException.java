package com.sunny.hubsso.auth.exception;

import com.sunny.hubsso.common.exception.UnauthorizedException;

/**
 * 未登录异常
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class UnauthenticatedException extends UnauthorizedException {

    public UnauthenticatedException(String message, Object... args) {
        super(message, args);
    }

    public UnauthenticatedException(Throwable cause, String message, Object... args) {
        super(cause, message, args);
    }
}
