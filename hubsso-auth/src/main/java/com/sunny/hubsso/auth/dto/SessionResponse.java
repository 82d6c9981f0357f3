package com.sunny.hubsso.auth.dto;

import java.util.List;

import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.common.security.SessionClaims;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

/**
 * 用户会话视图
 */
@Data
@Builder
@Schema(name = "SessionResponse")
public class SessionResponse {

    private Long userId;
    private String email;
    private Long hubId;
    private String name;
    private List<String> roles;
    private Long expiresAt;

    public static SessionResponse from(SessionClaims claims) {
        return SessionResponse.builder()
                .userId(Long.valueOf(claims.subject()))
                .email(claims.email())
                .hubId(claims.hubId())
                .name(claims.name())
                .roles(claims.roles())
                .expiresAt(claims.expiresAt())
                .build();
    }

    public static SessionResponse from(Identity identity) {
        return SessionResponse.builder()
                .userId(identity.id())
                .email(identity.email())
                .hubId(identity.hubId())
                .name(identity.displayName() == null ? "" : identity.displayName())
                .roles(identity.roles())
                .build();
    }
}
