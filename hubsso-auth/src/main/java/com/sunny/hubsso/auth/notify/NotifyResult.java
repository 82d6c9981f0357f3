package com.sunny.hubsso.auth.notify;

/**
 * 通知发送结果
 */
public record NotifyResult(boolean success, String message) {

    public static NotifyResult ok() {
        return new NotifyResult(true, "发送成功");
    }

    public static NotifyResult fail(String message) {
        return new NotifyResult(false, message);
    }
}
