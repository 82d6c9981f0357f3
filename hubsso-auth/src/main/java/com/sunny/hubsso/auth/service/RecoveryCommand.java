package com.sunny.hubsso.auth.service;

import lombok.Data;

/**
 * 密码找回命令
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Data
public class RecoveryCommand {

    private String email;
    private Long hubId;
}
