package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;

/**
 * Internal异常
 * 描述Internal异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class InternalException extends HubSsoRuntimeException {

    public InternalException(String message, Object... args) {
        super(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, message, args);
    }

    public InternalException(Throwable cause, String message, Object... args) {
        super(cause, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, message, args);
    }

    public InternalException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.INTERNAL_ERROR, type, context, message, args);
    }

    public InternalException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.INTERNAL_ERROR, type, context, message, args);
    }
}
