package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.common.GatewayException;

/**
 * Thrown when an OAuth authorization attempt fails. The attempt cannot be resumed;
 * the caller has to start a new login.
 */
public class AuthenticationException extends GatewayException {

    /**
     * Why the attempt failed
     */
    public enum Reason {
        STATE_MISMATCH,
        AUTHORIZATION_DENIED,
        MISSING_CODE,
        TOKEN_EXCHANGE_FAILED
    }

    private final Reason reason;

    public AuthenticationException(String backendId, Reason reason, String message) {
        super(backendId, message, false);
        this.reason = reason;
    }

    public AuthenticationException(String backendId, Reason reason, String message, Throwable cause) {
        super(backendId, message, false, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
