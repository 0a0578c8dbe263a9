package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.gateway.BackendId;

/**
 * Notified after a token manager has replaced its credential.
 */
@FunctionalInterface
public interface TokenRefreshListener {

    void onRefresh(BackendId backend, OAuthCredentials credentials);
}
