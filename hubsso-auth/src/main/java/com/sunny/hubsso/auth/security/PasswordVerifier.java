package com.sunny.hubsso.auth.security;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 凭证校验组件
 * 比对明文密码与存储的 BCrypt 哈希，格式异常的哈希一律视为不匹配
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordVerifier {

    private final PasswordEncoder passwordEncoder;

    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, storedHash);
        } catch (IllegalArgumentException e) {
            log.warn("security_event event=password_hash_invalid reason={}", e.getMessage());
            return false;
        }
    }
}
