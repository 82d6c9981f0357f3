package com.sunny.hubsso.auth.exception;

import java.util.Map;

import com.sunny.hubsso.common.constant.ErrorType;
import com.sunny.hubsso.common.exception.NotFoundException;

/**
 * 身份不存在异常
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class IdentityNotFoundException extends NotFoundException {

    public IdentityNotFoundException(String message, Object... args) {
        super(ErrorType.IDENTITY_NOT_FOUND, Map.of(), message, args);
    }
}
