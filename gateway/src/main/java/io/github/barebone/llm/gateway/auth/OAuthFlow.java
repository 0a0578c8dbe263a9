package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.gateway.GatewayTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * PKCE authorization code login for one backend.
 * <p>
 * The flow never opens a browser itself: the authorization URL is handed to a
 * caller-supplied listener which presents it to the user.
 */
public class OAuthFlow {

    private static final Logger logger = LoggerFactory.getLogger(OAuthFlow.class);

    private final OAuthClientConfig config;
    private final OAuthTokenClient tokenClient;
    private final SecureRandom secureRandom;

    public OAuthFlow(OAuthTokenClient tokenClient) {
        this(tokenClient, new SecureRandom());
    }

    public OAuthFlow(OAuthTokenClient tokenClient, SecureRandom secureRandom) {
        this.config = tokenClient.getConfig();
        this.tokenClient = tokenClient;
        this.secureRandom = secureRandom;
    }

    /**
     * Starts an authorization: generates PKCE verifier and state, and for loopback
     * backends binds the callback listener on the redirect port.
     */
    public AuthorizationSession begin() throws AuthenticationException {
        return begin(config.getCallbackPort());
    }

    AuthorizationSession begin(int callbackPort) throws AuthenticationException {
        PkceChallenge pkce = PkceChallenge.generate(secureRandom);
        String state = PkceChallenge.createState(secureRandom);
        String url = buildAuthorizationUrl(pkce, state);

        CallbackServer server = null;
        if (config.getRedirectMode() == OAuthClientConfig.RedirectMode.LOOPBACK) {
            try {
                server = new CallbackServer(config.getBackendId().getId(), callbackPort,
                        config.getCallbackPath(), state);
            } catch (IOException e) {
                throw new AuthenticationException(config.getBackendId().getId(),
                        AuthenticationException.Reason.AUTHORIZATION_DENIED,
                        "Could not listen on 127.0.0.1:" + callbackPort + " for the OAuth callback", e);
            }
        }
        return new AuthorizationSession(tokenClient, pkce, state, url, server);
    }

    /**
     * Runs a loopback login: surfaces the URL, waits for the redirect and exchanges the code.
     * The listener is stopped on every exit path.
     */
    public OAuthCredentials login(Consumer<String> urlListener, Duration timeout)
            throws AuthenticationException, GatewayTimeoutException {
        try (AuthorizationSession session = begin()) {
            urlListener.accept(session.getAuthorizationUrl());
            return session.awaitCallback(timeout);
        }
    }

    /**
     * Runs a manual-code login: surfaces the URL, then reads {@code code#state} from the supplier.
     */
    public OAuthCredentials login(Consumer<String> urlListener, Supplier<String> pastedCode)
            throws GatewayException {
        try (AuthorizationSession session = begin()) {
            urlListener.accept(session.getAuthorizationUrl());
            return session.completeWithPastedCode(pastedCode.get());
        }
    }

    /**
     * Builds the authorization URL with PKCE parameters and the backend's extra parameters.
     */
    String buildAuthorizationUrl(PkceChallenge pkce, String state) {
        Map<String, String> params = new LinkedHashMap<>(config.getExtraAuthorizeParams());
        params.put("response_type", "code");
        params.put("client_id", config.getClientId());
        params.put("redirect_uri", config.getRedirectUri());
        if (config.getScope() != null) {
            params.put("scope", config.getScope());
        }
        params.put("code_challenge", pkce.getChallenge());
        params.put("code_challenge_method", PkceChallenge.METHOD);
        params.put("state", state);

        String query = params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" +
                        URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("&"));
        logger.debug("Built authorization URL for {}", config.getBackendId());
        return config.getAuthorizeUrl() + "?" + query;
    }
}
