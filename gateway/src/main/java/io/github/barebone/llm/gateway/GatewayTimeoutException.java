package io.github.barebone.llm.gateway;

import io.github.barebone.llm.common.GatewayException;

import java.time.Duration;

/**
 * Thrown when a bounded wait elapses: the OAuth callback wait or an overall request deadline.
 */
public class GatewayTimeoutException extends GatewayException {

    private final Duration timeout;

    public GatewayTimeoutException(String backendId, String message, Duration timeout) {
        super(backendId, message, true);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
