package com.sunny.hubsso.common.security;

import com.sunny.hubsso.common.exception.TokenRejectedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.crypto.SecretKey;

/**
 * 会话Token编解码器
 * 负责会话声明与 HS256 签名 Token 之间的转换
 *
 * <p>解码失败统一抛出 {@link TokenRejectedException}：</p>
 * <ul>
 *   <li>MALFORMED：空串、不含分段分隔符，或签名通过但缺少必需声明</li>
 *   <li>EXPIRED：签名有效且 exp 不晚于当前时间</li>
 *   <li>BAD_SIGNATURE：其余无法用当前密钥验证的输入，包括任一字符被改动的Token</li>
 * </ul>
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class TokenCodec {

    public static final int MIN_SECRET_BYTES = 32;

    private static final char SEPARATOR = '.';
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_-]+");

    private final Clock clock;

    public TokenCodec(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String encode(SessionClaims claims, String secret) {
        Objects.requireNonNull(claims, "claims");
        SecretKey key = signingKey(secret);
        return Jwts.builder()
                .subject(claims.subject())
                .claim(SessionClaimNames.EMAIL, claims.email())
                .claim(SessionClaimNames.HUB_ID, claims.hubId())
                .claim(SessionClaimNames.NAME, claims.name())
                .claim(SessionClaimNames.ROLES, claims.roles())
                .expiration(Date.from(Instant.ofEpochSecond(claims.expiresAt())))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public SessionClaims decode(String token, String secret) {
        SecretKey key = signingKey(secret);
        if (token == null || token.isBlank() || token.indexOf(SEPARATOR) < 0) {
            throw new TokenRejectedException(TokenRejectionReason.MALFORMED);
        }
        // 解码器会忽略末位字符的填充位，非规范编码视为篡改
        if (!isCanonical(token)) {
            throw new TokenRejectedException(TokenRejectionReason.BAD_SIGNATURE);
        }

        Claims payload;
        try {
            payload = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenRejectedException(e, TokenRejectionReason.EXPIRED);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenRejectedException(e, TokenRejectionReason.BAD_SIGNATURE);
        }

        SessionClaims claims = toSessionClaims(payload);
        // exp 恰好等于当前秒也视为过期
        if (claims.expiresAt() <= clock.instant().getEpochSecond()) {
            throw new TokenRejectedException(TokenRejectionReason.EXPIRED);
        }
        return claims;
    }

    private static SecretKey signingKey(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Token密钥不能为空");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("Token密钥长度不能少于" + MIN_SECRET_BYTES + "字节");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    private static boolean isCanonical(String token) {
        String[] segments = token.split("\\.", -1);
        if (segments.length != 3) {
            return false;
        }
        for (String segment : segments) {
            if (!SEGMENT.matcher(segment).matches()) {
                return false;
            }
            try {
                if (!Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(segment)).equals(segment)) {
                    return false;
                }
            } catch (DecodingException e) {
                return false;
            }
        }
        return true;
    }

    private static SessionClaims toSessionClaims(Claims payload) {
        String subject = payload.getSubject();
        Object email = payload.get(SessionClaimNames.EMAIL);
        Object hubId = payload.get(SessionClaimNames.HUB_ID);
        Object name = payload.get(SessionClaimNames.NAME);
        Object roles = payload.get(SessionClaimNames.ROLES);
        Date expiration = payload.getExpiration();

        if (subject == null
                || !(email instanceof String)
                || !(hubId instanceof Number)
                || !(name instanceof String)
                || !(roles instanceof List<?>)
                || expiration == null) {
            throw new TokenRejectedException(TokenRejectionReason.MALFORMED);
        }

        List<String> roleNames = new ArrayList<>();
        for (Object role : (List<?>) roles) {
            if (!(role instanceof String roleName)) {
                throw new TokenRejectedException(TokenRejectionReason.MALFORMED);
            }
            roleNames.add(roleName);
        }

        return new SessionClaims(
                subject,
                (String) email,
                ((Number) hubId).longValue(),
                (String) name,
                roleNames,
                expiration.toInstant().getEpochSecond());
    }
}
