package com.sunny.hubsso.common.exception;

import com.sunny.hubsso.common.security.TokenRejectionReason;
import java.util.Map;

/**
 * Token拒绝异常
 * 携带具体拒绝原因，HTTP语义为401
 *
 * @author Sunny
 * @date 2026-10-17
 */
public class TokenRejectedException extends UnauthorizedException {

    private final TokenRejectionReason reason;

    public TokenRejectedException(TokenRejectionReason reason) {
        super(reason.getErrorType(), Map.of("reason", reason.name()), reason.getMessage());
        this.reason = reason;
    }

    public TokenRejectedException(Throwable cause, TokenRejectionReason reason) {
        super(cause, reason.getErrorType(), Map.of("reason", reason.name()), reason.getMessage());
        this.reason = reason;
    }

    public TokenRejectionReason getReason() {
        return reason;
    }
}
