package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;

import java.net.http.HttpRequest;

/**
 * Adds credentials to outgoing backend requests.
 */
public interface RequestAuthorizer {

    /**
     * Adds authorization headers to the request.
     *
     * @return the secret that was used, so a rejection can be matched to it
     */
    String authorize(HttpRequest.Builder request) throws GatewayException;

    /**
     * Called when the backend answered 401 to a request authorized with {@code rejectedSecret}.
     *
     * @return true if the request should be retried once with fresh credentials
     */
    default boolean onUnauthorized(String rejectedSecret) throws GatewayException {
        return false;
    }

    /**
     * Whether requests are made with an OAuth token rather than an API key
     */
    boolean isOAuth();

    /**
     * Whether credentials are present
     */
    boolean isConfigured();
}
