package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.common.GatewayException;

/**
 * Thrown when a token refresh fails.
 * <p>
 * Network failures are retryable and leave the previous credential in place.
 * A rejection by the token endpoint is fatal and requires a new login; the
 * endpoint's status and body are kept for diagnosis.
 */
public class TokenRefreshException extends GatewayException {

    private final int statusCode;
    private final String responseBody;

    public TokenRefreshException(String backendId, String message, Throwable cause) {
        super(backendId, message, true, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public TokenRefreshException(String backendId, String message, int statusCode, String responseBody) {
        super(backendId, message, false);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * HTTP status of the rejected refresh, or -1 for network failures
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
