package com.sunny.hubsso.auth.security;

import java.util.Optional;

/**
 * 测试用会话载体
 */
public class InMemorySessionStore implements SessionStore {

    private String token;
    private int clearCount;

    public InMemorySessionStore() {
    }

    public InMemorySessionStore(String token) {
        this.token = token;
    }

    @Override
    public void store(String token) {
        this.token = token;
    }

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(token);
    }

    @Override
    public void clear() {
        token = null;
        clearCount++;
    }

    public int getClearCount() {
        return clearCount;
    }
}
