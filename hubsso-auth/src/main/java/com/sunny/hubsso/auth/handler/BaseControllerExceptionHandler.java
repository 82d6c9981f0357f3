package com.sunny.hubsso.auth.handler;

import com.sunny.hubsso.common.exception.BadRequestException;
import com.sunny.hubsso.common.exception.ExceptionMapper;
import com.sunny.hubsso.common.exception.HubSsoRuntimeException;
import com.sunny.hubsso.common.response.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.TreeMap;
import java.util.Map;

/**
 * BaseController异常处理器
 * 负责BaseController异常处理流程与结果输出
 *
 * @author Sunny
 * @date 2026-10-17
 */
public abstract class BaseControllerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BaseControllerExceptionHandler.class);

    @ExceptionHandler(HubSsoRuntimeException.class)
    public ErrorResponse handleHubSsoRuntimeException(HubSsoRuntimeException exception,
                                                      HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    /**
     * MethodArgumentNotValidException 是 BindException 的子类
     */
    @ExceptionHandler(BindException.class)
    public ErrorResponse handleValidationException(BindException exception, HttpServletResponse response) {
        Map<String, String> errors = new TreeMap<>();
        exception.getBindingResult().getAllErrors()
                .forEach(error -> errors.put(resolveErrorKey(error), error.getDefaultMessage()));

        String message = errors.isEmpty() ? "参数验证失败" : errors.toString();
        return buildErrorResponse(new BadRequestException(exception, message), response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ErrorResponse handleMissingParameter(MissingServletRequestParameterException exception,
                                                HttpServletResponse response) {
        return buildErrorResponse(
                new BadRequestException(exception, "缺少参数: %s", exception.getParameterName()), response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ErrorResponse handleUnreadableBody(HttpMessageNotReadableException exception,
                                              HttpServletResponse response) {
        return buildErrorResponse(new BadRequestException(exception, "请求体格式错误"), response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ErrorResponse handleTypeMismatch(MethodArgumentTypeMismatchException exception,
                                            HttpServletResponse response) {
        return buildErrorResponse(
                new BadRequestException(exception, "参数类型错误: %s", exception.getName()), response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ErrorResponse handleIllegalArgumentException(IllegalArgumentException exception,
                                                        HttpServletResponse response) {
        String message = exception.getMessage() == null ? "参数错误" : exception.getMessage();
        return buildErrorResponse(new BadRequestException(exception, message), response);
    }

    @ExceptionHandler(Exception.class)
    public ErrorResponse handleException(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    private String resolveErrorKey(ObjectError error) {
        if (error instanceof FieldError fieldError) {
            return fieldError.getField();
        }
        return error.getObjectName();
    }

    private ErrorResponse buildErrorResponse(Throwable throwable, HttpServletResponse response) {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(throwable);
        if (detail.serverError()) {
            log.error("服务异常: type={}, message={}", detail.type(), detail.message(), throwable);
        } else {
            log.warn("请求异常: type={}, message={}", detail.type(), detail.message());
        }

        response.setStatus(detail.httpStatus());
        return ErrorResponse.of(
                detail.httpStatus(),
                detail.type(),
                detail.message(),
                detail.context(),
                detail.traceId());
    }
}
