package com.sunny.hubsso.auth.notify;

/**
 * 密码找回通知内容
 *
 * @param recipient   收件邮箱
 * @param hubId       用户所属Hub
 * @param subject     通知标题
 * @param recoveryUrl 一次性登录链接
 * @param expiresAt   链接过期时间，epoch 秒
 */
public record RecoveryMessage(String recipient, long hubId, String subject, String recoveryUrl, long expiresAt) {
}
