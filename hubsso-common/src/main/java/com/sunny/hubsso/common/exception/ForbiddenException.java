package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;

/**
 * Forbidden异常
 * 描述Forbidden异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class ForbiddenException extends HubSsoRuntimeException {

    public ForbiddenException(String message, Object... args) {
        super(Code.FORBIDDEN, ErrorType.FORBIDDEN, message, args);
    }

    public ForbiddenException(Throwable cause, String message, Object... args) {
        super(cause, Code.FORBIDDEN, ErrorType.FORBIDDEN, message, args);
    }

    public ForbiddenException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.FORBIDDEN, type, context, message, args);
    }

    public ForbiddenException(Throwable cause,
                              String type,
                              Map<String, String> context,
                              String message,
                              Object... args) {
        super(cause, Code.FORBIDDEN, type, context, message, args);
    }
}
