package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;

/**
 * Unauthorized异常
 * 描述Unauthorized异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class UnauthorizedException extends HubSsoRuntimeException {

    public UnauthorizedException(String message, Object... args) {
        super(Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, message, args);
    }

    public UnauthorizedException(Throwable cause, String message, Object... args) {
        super(cause, Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, message, args);
    }

    public UnauthorizedException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.UNAUTHORIZED, type, context, message, args);
    }

    public UnauthorizedException(Throwable cause,
                                 String type,
                                 Map<String, String> context,
                                 String message,
                                 Object... args) {
        super(cause, Code.UNAUTHORIZED, type, context, message, args);
    }
}
