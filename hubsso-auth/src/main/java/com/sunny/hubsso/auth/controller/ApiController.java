package com.sunny.hubsso.auth.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.sunny.hubsso.auth.dto.SessionResponse;
import com.sunny.hubsso.auth.exception.IdentityNotFoundException;
import com.sunny.hubsso.auth.model.IdentityQuery;
import com.sunny.hubsso.auth.repository.IdentityRepository;
import com.sunny.hubsso.auth.security.AccessPolicy;
import com.sunny.hubsso.auth.security.AuthorizationGuard;
import com.sunny.hubsso.auth.security.SessionAuthInterceptor;
import com.sunny.hubsso.common.response.ApiResponse;
import com.sunny.hubsso.common.security.SessionClaims;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 身份查询接口
 *
 * @author Sunny
 * @date 2026-10-17
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "身份查询", description = "查询当前用户或同Hub用户")
public class ApiController {

    private final IdentityRepository identityRepository;
    private final AuthorizationGuard authorizationGuard;

    @Operation(summary = "查询当前用户，或按ID查询同Hub用户")
    @GetMapping("/id")
    public ApiResponse<SessionResponse> identity(
            @RequestAttribute(SessionAuthInterceptor.CLAIMS_ATTRIBUTE) SessionClaims claims,
            @RequestParam(value = "id", required = false) Long id) {
        if (id == null) {
            return ApiResponse.ok(SessionResponse.from(claims));
        }
        // 其他Hub的用户按不存在处理
        return identityRepository.findById(id)
                .filter(identity -> authorizationGuard
                        .authorize(claims, AccessPolicy.AUTHENTICATED_OWN_HUB, identity.hubId())
                        .allowed())
                .map(identity -> ApiResponse.ok(SessionResponse.from(identity)))
                .orElseThrow(() -> new IdentityNotFoundException("用户不存在"));
    }

    @Operation(summary = "列出当前Hub的用户，可按角色与关键字过滤")
    @GetMapping("/users")
    public ApiResponse<List<SessionResponse>> users(
            @RequestAttribute(SessionAuthInterceptor.CLAIMS_ATTRIBUTE) SessionClaims claims,
            @RequestParam(value = "role", required = false) String role,
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "page", required = false) Integer page) {
        authorizationGuard.authorize(claims, AccessPolicy.AUTHENTICATED_OWN_HUB, claims.hubId()).orThrow();
        List<SessionResponse> users = identityRepository
                .listByHub(IdentityQuery.of(claims.hubId(), role, query, page))
                .stream()
                .map(SessionResponse::from)
                .toList();
        return ApiResponse.ok(users);
    }
}
