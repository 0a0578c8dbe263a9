package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Talks to a backend's OAuth token endpoint: the authorization code grant after
 * login and the refresh token grant afterwards.
 */
public class OAuthTokenClient {

    private static final Logger logger = LoggerFactory.getLogger(OAuthTokenClient.class);

    private static final int REQUEST_TIMEOUT_SECONDS = 30;

    private final OAuthClientConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OAuthTokenClient(OAuthClientConfig config, HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public OAuthClientConfig getConfig() {
        return config;
    }

    /**
     * Exchanges an authorization code for tokens.
     */
    public OAuthCredentials exchangeCode(String code, String verifier, String state) throws AuthenticationException {
        String backendId = config.getBackendId().getId();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("client_id", config.getClientId());
        params.put("code", code);
        if (config.isStateInTokenRequest()) {
            params.put("state", state);
        }
        params.put("redirect_uri", config.getRedirectUri());
        params.put("code_verifier", verifier);

        HttpResponse<String> response;
        try {
            response = post(params);
        } catch (IOException e) {
            throw new AuthenticationException(backendId, AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED,
                    "Token exchange with " + backendId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException(backendId, AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED,
                    "Token exchange with " + backendId + " was interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new AuthenticationException(backendId, AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED,
                    "Token exchange rejected (" + response.statusCode() + "): " + response.body());
        }

        try {
            return parseTokenResponse(response.body(), null);
        } catch (IOException e) {
            throw new AuthenticationException(backendId, AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED,
                    "Invalid token response from " + backendId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Uses the refresh token of the given credentials to obtain new ones.
     * The previous refresh token and account id are kept when the endpoint omits them.
     */
    public OAuthCredentials refresh(OAuthCredentials current) throws TokenRefreshException {
        String backendId = config.getBackendId().getId();
        if (!current.hasRefreshToken()) {
            throw new TokenRefreshException(backendId, "No refresh token available - log in again", -1, null);
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "refresh_token");
        params.put("client_id", config.getClientId());
        params.put("refresh_token", current.getRefreshToken());

        HttpResponse<String> response;
        try {
            response = post(params);
        } catch (IOException e) {
            throw new TokenRefreshException(backendId, "Token refresh request to " + backendId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRefreshException(backendId, "Token refresh for " + backendId + " was interrupted", e);
        }

        if (response.statusCode() != 200) {
            logger.warn("Token refresh for {} rejected with status {}", backendId, response.statusCode());
            throw new TokenRefreshException(backendId,
                    "Token refresh rejected (" + response.statusCode() + ") - log in again",
                    response.statusCode(), response.body());
        }

        try {
            return parseTokenResponse(response.body(), current);
        } catch (IOException e) {
            throw new TokenRefreshException(backendId,
                    "Invalid token refresh response: " + e.getMessage(), response.statusCode(), response.body());
        }
    }

    private HttpResponse<String> post(Map<String, String> params) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.getTokenUrl()))
                .timeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .header("Accept", "application/json");

        if (config.getTokenEncoding() == OAuthClientConfig.TokenEncoding.JSON) {
            ObjectNode body = objectMapper.createObjectNode();
            params.forEach(body::put);
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        } else {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(formEncode(params)));
        }

        logger.debug("POST {} (grant_type={})", config.getTokenUrl(), params.get("grant_type"));
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private OAuthCredentials parseTokenResponse(String body, OAuthCredentials previous) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        String accessToken = root.path("access_token").asText("");
        if (accessToken.isEmpty()) {
            throw new IOException("missing access_token");
        }
        JsonNode expiresIn = root.get("expires_in");
        if (expiresIn == null || !expiresIn.canConvertToLong()) {
            throw new IOException("missing expires_in");
        }

        String refreshToken = root.path("refresh_token").asText("");
        if (refreshToken.isEmpty() && previous != null) {
            refreshToken = previous.getRefreshToken();
        }

        String accountId = previous != null ? previous.getAccountId() : null;
        if (config.isAccountIdFromToken()) {
            accountId = JwtClaims.extractAccountId(accessToken, objectMapper).orElse(accountId);
        }

        return OAuthCredentials.fromExpiresIn(accessToken, refreshToken, expiresIn.asLong(), accountId, clock);
    }

    static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" +
                        URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
