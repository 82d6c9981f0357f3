package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;

/**
 * NotFound异常
 * 描述NotFound异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class NotFoundException extends HubSsoRuntimeException {

    public NotFoundException(String message, Object... args) {
        super(Code.NOT_FOUND, ErrorType.NOT_FOUND, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(cause, Code.NOT_FOUND, ErrorType.NOT_FOUND, message, args);
    }

    public NotFoundException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.NOT_FOUND, type, context, message, args);
    }

    public NotFoundException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.NOT_FOUND, type, context, message, args);
    }
}
