package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.gateway.GatewayTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * One in-progress PKCE authorization. Holds the verifier and state, and the
 * loopback listener when the backend redirects to one. Closing the session
 * stops the listener.
 */
public class AuthorizationSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationSession.class);

    private final OAuthTokenClient tokenClient;
    private final PkceChallenge pkce;
    private final String state;
    private final String authorizationUrl;
    private final CallbackServer callbackServer;

    AuthorizationSession(OAuthTokenClient tokenClient, PkceChallenge pkce, String state,
                         String authorizationUrl, CallbackServer callbackServer) {
        this.tokenClient = tokenClient;
        this.pkce = pkce;
        this.state = state;
        this.authorizationUrl = authorizationUrl;
        this.callbackServer = callbackServer;
    }

    /**
     * URL the user opens in a browser
     */
    public String getAuthorizationUrl() {
        return authorizationUrl;
    }

    public String getState() {
        return state;
    }

    /**
     * Port of the loopback listener, or -1 when the backend uses manual code entry
     */
    public int getCallbackPort() {
        return callbackServer != null ? callbackServer.getPort() : -1;
    }

    /**
     * Waits for the loopback redirect and exchanges the received code.
     */
    public OAuthCredentials awaitCallback(Duration timeout) throws AuthenticationException, GatewayTimeoutException {
        if (callbackServer == null) {
            throw new IllegalStateException("Backend " + backendId() + " does not redirect to a loopback listener");
        }
        String code = callbackServer.awaitCode(timeout);
        return exchange(code);
    }

    /**
     * Completes the login with the value shown by the provider, {@code code#state}.
     * A bare code is accepted; a state that does not match this session is rejected.
     */
    public OAuthCredentials completeWithPastedCode(String pasted) throws AuthenticationException {
        String input = pasted != null ? pasted.trim() : "";
        String code = input;
        String pastedState = null;
        int hash = input.indexOf('#');
        if (hash >= 0) {
            code = input.substring(0, hash);
            pastedState = input.substring(hash + 1);
        }

        if (pastedState != null && !pastedState.equals(state)) {
            logger.warn("Rejected pasted authorization code for {}: state mismatch", backendId());
            throw new AuthenticationException(backendId(), AuthenticationException.Reason.STATE_MISMATCH,
                    "OAuth state mismatch");
        }
        if (code.isEmpty()) {
            throw new AuthenticationException(backendId(), AuthenticationException.Reason.MISSING_CODE,
                    "No authorization code entered");
        }
        return exchange(code);
    }

    private OAuthCredentials exchange(String code) throws AuthenticationException {
        OAuthCredentials credentials = tokenClient.exchangeCode(code, pkce.getVerifier(), state);
        logger.info("OAuth login for {} completed", backendId());
        return credentials;
    }

    private String backendId() {
        return tokenClient.getConfig().getBackendId().getId();
    }

    @Override
    public void close() {
        if (callbackServer != null) {
            callbackServer.close();
        }
    }
}
