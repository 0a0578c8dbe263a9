package io.github.barebone.llm.common;

/**
 * Root of all checked exceptions raised by the gateway.
 * Carries the backend that produced the failure (when known) and whether
 * the caller may reasonably retry the operation.
 */
public class GatewayException extends Exception {

    private final String backendId;
    private final boolean retryable;

    public GatewayException(String message) {
        this(null, message, false, null);
    }

    public GatewayException(String message, Throwable cause) {
        this(null, message, false, cause);
    }

    public GatewayException(String backendId, String message, boolean retryable) {
        this(backendId, message, retryable, null);
    }

    public GatewayException(String backendId, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
        this.retryable = retryable;
    }

    /**
     * Backend identifier, or null when the failure is not tied to one backend
     */
    public String getBackendId() {
        return backendId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
