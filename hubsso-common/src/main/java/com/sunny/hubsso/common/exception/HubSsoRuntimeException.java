package com.sunny.hubsso.common.exception;

import java.util.Map;

/**
 * Runtime异常
 * 描述Runtime异常语义与错误上下文
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class HubSsoRuntimeException extends RuntimeException {

    private final int code;
    private final String type;
    private final Map<String, String> context;

    protected HubSsoRuntimeException(int code,
                                     String type,
                                     String message,
                                     Object... args) {
        this(code, type, null, null, format(message, args));
    }

    protected HubSsoRuntimeException(int code,
                                     String type,
                                     Map<String, String> context,
                                     String message,
                                     Object... args) {
        this(code, type, context, null, format(message, args));
    }

    protected HubSsoRuntimeException(Throwable cause,
                                     int code,
                                     String type,
                                     String message,
                                     Object... args) {
        this(code, type, null, cause, format(message, args));
    }

    protected HubSsoRuntimeException(Throwable cause,
                                     int code,
                                     String type,
                                     Map<String, String> context,
                                     String message,
                                     Object... args) {
        this(code, type, context, cause, format(message, args));
    }

    private HubSsoRuntimeException(int code,
                                   String type,
                                   Map<String, String> context,
                                   Throwable cause,
                                   String message) {
        super(message, cause);
        this.code = code;
        this.type = type;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public int getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    public Map<String, String> getContext() {
        return context;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
