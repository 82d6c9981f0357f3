package com.sunny.hubsso.auth.service.impl;

import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;
import com.sunny.hubsso.auth.exception.IdentityNotFoundException;
import com.sunny.hubsso.auth.model.Identity;
import com.sunny.hubsso.auth.notify.NotifyResult;
import com.sunny.hubsso.auth.notify.RecoveryMessage;
import com.sunny.hubsso.auth.notify.RecoveryNotifier;
import com.sunny.hubsso.auth.repository.IdentityRepository;
import com.sunny.hubsso.auth.security.ClaimsBuilder;
import com.sunny.hubsso.auth.service.RecoveryCommand;
import com.sunny.hubsso.auth.service.RecoveryService;
import com.sunny.hubsso.auth.service.RecoveryTicket;
import com.sunny.hubsso.common.security.SessionClaims;
import com.sunny.hubsso.common.security.TokenCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 密码找回服务实现
 * 签发一天有效的找回Token并通过通知渠道发送登录链接
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryServiceImpl implements RecoveryService {

    static final String RECOVERY_PATH = "/auth/login?token=";

    private final IdentityRepository identityRepository;
    private final ClaimsBuilder claimsBuilder;
    private final TokenCodec tokenCodec;
    private final RecoveryNotifier recoveryNotifier;
    private final AuthSecurityProperties securityProperties;

    @Override
    public RecoveryTicket requestRecovery(RecoveryCommand command) {
        String email = command.getEmail() == null ? "" : command.getEmail().trim().toLowerCase(Locale.ROOT);
        Long hubId = command.getHubId();
        Identity identity = hubId == null
                ? null
                : identityRepository.findByEmailAndHub(email, hubId).orElse(null);
        if (identity == null) {
            log.warn("security_event event=recovery_unknown_identity hubId={} email={}", hubId, email);
            throw new IdentityNotFoundException("用户不存在");
        }

        SessionClaims claims = claimsBuilder.build(identity, securityProperties.getToken().getRecoveryLifetime());
        String token = tokenCodec.encode(claims, securityProperties.getToken().getSecret());
        String recoveryUrl = buildRecoveryUrl(token);

        AuthSecurityProperties.Recovery recovery = securityProperties.getRecovery();
        NotifyResult result = recoveryNotifier.publish(new RecoveryMessage(
                claims.email(), identity.hubId(), recovery.getSubject(), recoveryUrl, claims.expiresAt()));
        if (result.success()) {
            log.info("security_event event=recovery_issued userId={} hubId={}", identity.id(), identity.hubId());
        } else {
            log.warn("security_event event=recovery_notify_failed userId={} hubId={} error={}",
                    identity.id(), identity.hubId(), result.message());
        }
        return new RecoveryTicket(token, claims.expiresAt(), recoveryUrl, result.success());
    }

    private String buildRecoveryUrl(String token) {
        String baseUrl = StringUtils.trimTrailingCharacter(securityProperties.getRecovery().getPublicBaseUrl(), '/');
        return baseUrl + RECOVERY_PATH + token;
    }
}
