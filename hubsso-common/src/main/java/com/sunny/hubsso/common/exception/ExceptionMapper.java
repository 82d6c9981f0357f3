package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.constant.Code;
import com.sunny.hubsso.common.constant.ErrorType;
import java.util.Map;
import org.slf4j.MDC;

/**
 * 异常Mapper
 * 负责将异常统一映射为状态码、错误类型与消息
 *
 * @author Sunny
 * @date 2026-10-17
 */
public final class ExceptionMapper {

    private static final String DEFAULT_INTERNAL_MESSAGE = "服务器内部错误";

    private ExceptionMapper() {
    }

    public static ExceptionDetail resolve(Throwable throwable) {
        Throwable target = throwable == null ? new InternalException(DEFAULT_INTERNAL_MESSAGE) : throwable;
        String message = resolveMessage(target);
        String traceId = resolveTraceId();

        if (target instanceof HubSsoRuntimeException runtimeException) {
            return new ExceptionDetail(
                    runtimeException.getCode(),
                    runtimeException.getType(),
                    message,
                    runtimeException.getContext(),
                    traceId,
                    runtimeException.getCode() >= Code.INTERNAL_ERROR);
        }
        if (target instanceof IllegalArgumentException) {
            return new ExceptionDetail(Code.BAD_REQUEST, ErrorType.BAD_REQUEST, message, Map.of(), traceId, false);
        }
        // 未识别异常不向调用方暴露内部信息
        return new ExceptionDetail(
                Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, DEFAULT_INTERNAL_MESSAGE, Map.of(), traceId, true);
    }

    private static String resolveMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }

        return DEFAULT_INTERNAL_MESSAGE;
    }

    private static String resolveTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId != null && !traceId.isBlank()) {
            return traceId;
        }
        return null;
    }

    public record ExceptionDetail(
            int httpStatus,
            String type,
            String message,
            Map<String, String> context,
            String traceId,
            boolean serverError) {
    }
}
