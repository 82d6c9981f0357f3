package com.sunny.hubsso.auth.handler;

import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.sunny.hubsso.auth.controller.ApiController;
import com.sunny.hubsso.auth.exception.InvalidCredentialsException;
import com.sunny.hubsso.auth.exception.UnauthenticatedException;
import com.sunny.hubsso.auth.security.AuthorizationDecision;
import com.sunny.hubsso.auth.security.DenyReason;
import com.sunny.hubsso.common.constant.ErrorType;
import com.sunny.hubsso.common.exception.ForbiddenException;
import com.sunny.hubsso.common.response.ErrorResponse;
import com.sunny.hubsso.common.security.SessionClaims;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuthControllerExceptionHandlerTest {

    private final AuthControllerExceptionHandler handler = new AuthControllerExceptionHandler();

    @Test
    void handleRuntimeException_shouldMapInvalidCredentialsTo401() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        ErrorResponse errorResponse = handler.handleHubSsoRuntimeException(new InvalidCredentialsException(), response);

        assertEquals(401, response.getStatus());
        assertEquals(401, errorResponse.getCode());
        assertEquals(ErrorType.INVALID_CREDENTIALS, errorResponse.getType());
        assertEquals("邮箱或密码错误", errorResponse.getMessage());
    }

    @Test
    void handleRuntimeException_shouldKeepForbiddenDistinctFromUnauthenticated() {
        ForbiddenException forbidden = assertThrows(ForbiddenException.class,
                () -> AuthorizationDecision.deny(DenyReason.WRONG_HUB).orThrow());
        MockHttpServletResponse forbiddenResponse = new MockHttpServletResponse();
        MockHttpServletResponse unauthenticatedResponse = new MockHttpServletResponse();

        ErrorResponse denied = handler.handleHubSsoRuntimeException(forbidden, forbiddenResponse);
        handler.handleHubSsoRuntimeException(new UnauthenticatedException("未登录或登录已过期"), unauthenticatedResponse);

        assertEquals(403, forbiddenResponse.getStatus());
        assertEquals(ErrorType.WRONG_HUB, denied.getType());
        assertEquals("WRONG_HUB", denied.getContext().get("reason"));
        assertEquals(401, unauthenticatedResponse.getStatus());
    }

    @Test
    void handleException_shouldHideInternalMessage() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        ErrorResponse errorResponse = handler.handleException(new IllegalStateException("mysql_unreachable"), response);

        assertEquals(500, response.getStatus());
        assertEquals(ErrorType.INTERNAL_ERROR, errorResponse.getType());
        assertEquals("服务器内部错误", errorResponse.getMessage());
    }

    @Test
    void handleUnreadableBody_shouldMapMalformedJsonTo400() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        HttpMessageNotReadableException exception = new HttpMessageNotReadableException(
                "JSON parse error", new MockHttpInputMessage("{\"email\":".getBytes()));

        ErrorResponse errorResponse = handler.handleUnreadableBody(exception, response);

        assertEquals(400, response.getStatus());
        assertEquals(ErrorType.BAD_REQUEST, errorResponse.getType());
        assertEquals("请求体格式错误", errorResponse.getMessage());
    }

    @Test
    void handleTypeMismatch_shouldMapNonNumericParameterTo400() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MethodParameter parameter = new MethodParameter(
                ApiController.class.getMethod("identity", SessionClaims.class, Long.class), 1);
        MethodArgumentTypeMismatchException exception = new MethodArgumentTypeMismatchException(
                "abc", Long.class, "id", parameter, new NumberFormatException("For input string: \"abc\""));

        ErrorResponse errorResponse = handler.handleTypeMismatch(exception, response);

        assertEquals(400, response.getStatus());
        assertEquals(ErrorType.BAD_REQUEST, errorResponse.getType());
        assertEquals("参数类型错误: id", errorResponse.getMessage());
    }
}
