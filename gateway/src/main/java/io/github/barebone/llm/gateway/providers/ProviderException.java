package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;

/**
 * Exception thrown by backend adapters when a backend call fails.
 */
public class ProviderException extends GatewayException {

    private final int statusCode;

    public ProviderException(String backendId, String message, int statusCode, boolean retryable) {
        super(backendId, message, retryable);
        this.statusCode = statusCode;
    }

    public ProviderException(String backendId, String message, int statusCode, boolean retryable, Throwable cause) {
        super(backendId, message, retryable, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that caused the failure, or -1 when there was none
     */
    public int getStatusCode() {
        return statusCode;
    }
}
