package com.sunny.hubsso.auth.service;

import lombok.Data;

/**
 * 登录命令
 * clientIp 仅用于登录失败限流
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Data
public class LoginCommand {

    private String email;
    private String password;
    private Long hubId;
    private String clientIp;
}
