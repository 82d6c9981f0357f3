package com.sunny.hubsso.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 密码找回请求
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Data
@Schema(name = "RecoveryRequest")
public class RecoveryRequest {

    @NotBlank(message = "邮箱不能为空")
    private String email;

    @NotNull(message = "Hub不能为空")
    private Long hubId;
}
