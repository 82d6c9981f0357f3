package com.sunny.hubsso.auth.service;

/**
 * 密码找回服务
 *
 * @author Sunny
 * @date 2026-10-17
 */
public interface RecoveryService {

    RecoveryTicket requestRecovery(RecoveryCommand command);
}
