package com.sunny.hubsso.auth.security;

import java.time.Duration;
import java.util.Locale;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;
import com.sunny.hubsso.common.exception.TooManyRequestsException;

import lombok.extern.slf4j.Slf4j;
/**
 * 登录AttemptTracker组件
 * 按 Hub、邮箱与客户端IP 统计失败次数，超限后临时锁定
 *
 * @author Sunny
 * @date 2026-10-17
 */

@Component
@Slf4j
public class LoginAttemptTracker {

    private static final String FAIL_PREFIX = "hubsso:login:fail:";
    private static final String LOCK_PREFIX = "hubsso:login:lock:";

    private final StringRedisTemplate stringRedisTemplate;
    private final AuthSecurityProperties securityProperties;

    public LoginAttemptTracker(StringRedisTemplate stringRedisTemplate, AuthSecurityProperties securityProperties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.securityProperties = securityProperties;
    }

    public void assertLoginAllowed(Long hubId, String email, String clientIp) {
        if (!securityProperties.getLogin().isEnabled()) {
            return;
        }
        String locked = stringRedisTemplate.opsForValue().get(buildKey(LOCK_PREFIX, hubId, email, clientIp));
        if (locked != null) {
            log.warn("security_event event=login_locked hubId={} email={} clientIp={}", hubId, email, clientIp);
            throw new TooManyRequestsException("登录失败次数过多，请稍后重试");
        }
    }

    public void recordFailure(Long hubId, String email, String clientIp) {
        AuthSecurityProperties.Login login = securityProperties.getLogin();
        if (!login.isEnabled()) {
            return;
        }
        String failKey = buildKey(FAIL_PREFIX, hubId, email, clientIp);
        Long count = stringRedisTemplate.opsForValue().increment(failKey);
        if (count != null && count == 1L) {
            stringRedisTemplate.expire(failKey, Duration.ofSeconds(login.getWindowSeconds()));
        }
        if (count != null && count >= login.getMaxAttempts()) {
            stringRedisTemplate.opsForValue().set(
                    buildKey(LOCK_PREFIX, hubId, email, clientIp), "1", Duration.ofSeconds(login.getLockSeconds()));
            log.warn("security_event event=login_lock_applied hubId={} email={} clientIp={} failCount={}",
                    hubId, email, clientIp, count);
        }
    }

    public void clearFailures(Long hubId, String email, String clientIp) {
        if (!securityProperties.getLogin().isEnabled()) {
            return;
        }
        stringRedisTemplate.delete(buildKey(FAIL_PREFIX, hubId, email, clientIp));
        stringRedisTemplate.delete(buildKey(LOCK_PREFIX, hubId, email, clientIp));
    }

    private String buildKey(String prefix, Long hubId, String email, String clientIp) {
        return prefix + (hubId == null ? "unknown" : hubId) + ":" + normalize(email) + ":" + normalize(clientIp);
    }

    private String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
