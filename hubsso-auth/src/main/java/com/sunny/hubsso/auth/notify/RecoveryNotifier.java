package com.sunny.hubsso.auth.notify;

/**
 * 密码找回通知发送接口
 */
public interface RecoveryNotifier {

    /**
     * 发送找回通知，失败时返回失败结果而不抛出异常
     */
    NotifyResult publish(RecoveryMessage message);
}
