package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.gateway.auth.OAuthCredentials;
import io.github.barebone.llm.gateway.auth.TokenManager;

import java.net.http.HttpRequest;

/**
 * Sends the token manager's current access token as a bearer token, refreshing
 * it on expiry and after a 401. Optionally sends the credential's account id
 * in a backend-specific header.
 */
public class OAuthBearerAuthorizer implements RequestAuthorizer {

    private final TokenManager tokenManager;
    private final String accountIdHeader;

    public OAuthBearerAuthorizer(TokenManager tokenManager) {
        this(tokenManager, null);
    }

    public OAuthBearerAuthorizer(TokenManager tokenManager, String accountIdHeader) {
        this.tokenManager = tokenManager;
        this.accountIdHeader = accountIdHeader;
    }

    @Override
    public String authorize(HttpRequest.Builder request) throws GatewayException {
        OAuthCredentials credentials = tokenManager.getValidCredentials();
        request.header("Authorization", "Bearer " + credentials.getAccessToken());
        if (accountIdHeader != null && credentials.getAccountId() != null) {
            request.header(accountIdHeader, credentials.getAccountId());
        }
        return credentials.getAccessToken();
    }

    @Override
    public boolean onUnauthorized(String rejectedSecret) throws GatewayException {
        tokenManager.refreshIfCurrent(rejectedSecret);
        return true;
    }

    @Override
    public boolean isOAuth() {
        return true;
    }

    @Override
    public boolean isConfigured() {
        return tokenManager.hasCredentials();
    }

    public TokenManager getTokenManager() {
        return tokenManager;
    }
}
