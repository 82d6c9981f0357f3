package com.sunny.hubsso.auth.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.sunny.hubsso.auth.dto.LoginRequest;
import com.sunny.hubsso.auth.dto.RecoveryRequest;
import com.sunny.hubsso.auth.dto.RecoveryResponse;
import com.sunny.hubsso.auth.dto.SessionResponse;
import com.sunny.hubsso.auth.security.AuthCookieManager;
import com.sunny.hubsso.auth.service.LoginCommand;
import com.sunny.hubsso.auth.service.LoginResult;
import com.sunny.hubsso.auth.service.LoginService;
import com.sunny.hubsso.auth.service.RecoveryCommand;
import com.sunny.hubsso.auth.service.RecoveryService;
import com.sunny.hubsso.auth.service.RecoveryTicket;
import com.sunny.hubsso.common.response.ApiResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 认证控制器
 * 负责登录、找回与登出接口编排
 *
 * @author Sunny
 * @date 2026-10-17
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "登录认证", description = "登录、找回与登出接口")
public class AuthController {

    private final LoginService loginService;
    private final RecoveryService recoveryService;
    private final AuthCookieManager authCookieManager;

    @Operation(summary = "邮箱密码登录")
    @PostMapping("/login")
    public ApiResponse<SessionResponse> login(@Valid @RequestBody LoginRequest request,
                                              HttpServletRequest httpRequest,
                                              HttpServletResponse response) {
        LoginCommand command = new LoginCommand();
        command.setEmail(request.getEmail());
        command.setPassword(request.getPassword());
        command.setHubId(request.getHubId());
        command.setClientIp(httpRequest.getRemoteAddr());
        LoginResult result = loginService.login(command, authCookieManager.sessionStore(httpRequest, response));
        return ApiResponse.ok(SessionResponse.from(result.claims()));
    }

    @Operation(summary = "使用找回链接中的Token登录")
    @GetMapping("/login")
    public ApiResponse<SessionResponse> loginWithToken(@RequestParam("token") String token,
                                                       HttpServletRequest httpRequest,
                                                       HttpServletResponse response) {
        LoginResult result = loginService.loginWithToken(token, authCookieManager.sessionStore(httpRequest, response));
        return ApiResponse.ok(SessionResponse.from(result.claims()));
    }

    @Operation(summary = "申请密码找回")
    @PostMapping("/recover")
    public ApiResponse<RecoveryResponse> recover(@Valid @RequestBody RecoveryRequest request) {
        RecoveryCommand command = new RecoveryCommand();
        command.setEmail(request.getEmail());
        command.setHubId(request.getHubId());
        RecoveryTicket ticket = recoveryService.requestRecovery(command);
        return ApiResponse.ok(new RecoveryResponse(ticket.delivered(), ticket.expiresAt()));
    }

    @Operation(summary = "退出登录")
    @PostMapping("/logout")
    public ApiResponse<Void> logout(HttpServletRequest httpRequest, HttpServletResponse response) {
        loginService.logout(authCookieManager.sessionStore(httpRequest, response));
        return ApiResponse.ok();
    }
}
