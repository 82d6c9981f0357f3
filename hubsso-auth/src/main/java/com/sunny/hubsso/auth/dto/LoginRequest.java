package com.sunny.hubsso.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 登录请求
 * 邮箱在服务层统一转为小写
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Data
@Schema(name = "LoginRequest")
public class LoginRequest {

    @NotBlank(message = "邮箱不能为空")
    private String email;

    @NotBlank(message = "密码不能为空")
    private String password;

    @NotNull(message = "Hub不能为空")
    private Long hubId;
}
