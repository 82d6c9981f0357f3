package com.sunny.hubsso.auth.handler;

import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 认证Controller异常处理器
 * 负责认证Controller异常处理流程与结果输出
 *
 * @author Sunny
 * @date 2026-10-17
 */
@RestControllerAdvice
public class AuthControllerExceptionHandler extends BaseControllerExceptionHandler {
}
