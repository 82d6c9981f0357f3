package com.sunny.hubsso.auth.exception;

import java.util.Map;

import com.sunny.hubsso.common.constant.ErrorType;
import com.sunny.hubsso.common.exception.UnauthorizedException;

/**
 * 凭证无效异常
 * 用户不存在、密码错误与Token无效对外统一为同一类型与消息
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class InvalidCredentialsException extends UnauthorizedException {

    private static final String MESSAGE = "邮箱或密码错误";

    public InvalidCredentialsException() {
        super(ErrorType.INVALID_CREDENTIALS, Map.of(), MESSAGE);
    }

    public InvalidCredentialsException(Throwable cause) {
        super(cause, ErrorType.INVALID_CREDENTIALS, Map.of(), MESSAGE);
    }
}
