package io.github.barebone.llm.gateway.providers;

import java.time.Duration;
import java.util.Optional;

/**
 * The backend refused the request because of rate or usage limits.
 * Retryable by the caller with backoff; the gateway itself never retries it.
 */
public class RateLimitedException extends ProviderException {

    private final Duration retryAfter;

    public RateLimitedException(String backendId, String message, Duration retryAfter) {
        super(backendId, message, 429, true);
        this.retryAfter = retryAfter;
    }

    /**
     * Wait suggested by the backend, when it sent one
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
