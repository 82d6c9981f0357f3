package com.sunny.hubsso.auth.service;

/**
 * 找回凭据
 *
 * @param token       一天有效的找回Token
 * @param expiresAt   过期时间，epoch 秒
 * @param recoveryUrl 发送给用户的登录链接
 * @param delivered   通知是否发送成功，失败不影响Token有效性
 */
public record RecoveryTicket(String token, long expiresAt, String recoveryUrl, boolean delivered) {
}
