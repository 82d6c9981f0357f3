package com.sunny.hubsso.auth.security;

import java.util.Optional;

/**
 * 会话Token的绑定载体
 *
 * @author Sunny
 * @date 2026-10-17
 */
public interface SessionStore {

    void store(String token);

    Optional<String> load();

    /**
     * 清除已绑定的Token，可重复调用
     */
    void clear();
}
