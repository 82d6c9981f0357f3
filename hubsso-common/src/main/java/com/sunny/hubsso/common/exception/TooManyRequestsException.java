package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;

/**
 * TooManyRequests异常
 * 描述TooManyRequests异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class TooManyRequestsException extends HubSsoRuntimeException {

    public TooManyRequestsException(String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, message, args);
    }

    public TooManyRequestsException(Throwable cause, String message, Object... args) {
        super(cause, Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, message, args);
    }

    public TooManyRequestsException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, type, context, message, args);
    }

    public TooManyRequestsException(Throwable cause,
                                    String type,
                                    Map<String, String> context,
                                    String message,
                                    Object... args) {
        super(cause, Code.TOO_MANY_REQUESTS, type, context, message, args);
    }
}
