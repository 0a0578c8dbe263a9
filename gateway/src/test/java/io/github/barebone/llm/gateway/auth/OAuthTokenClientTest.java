package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.gateway.FakeBackendServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OAuthTokenClient.
 */
class OAuthTokenClientTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private FakeBackendServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeBackendServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private OAuthTokenClient anthropicClient() {
        OAuthClientConfig config = OAuthClientConfig.anthropic().toBuilder()
                .tokenUrl(server.baseUrl() + "/v1/oauth/token")
                .build();
        return new OAuthTokenClient(config, httpClient, objectMapper, clock);
    }

    private OAuthTokenClient codexClient() {
        OAuthClientConfig config = OAuthClientConfig.openAiCodex("pi").toBuilder()
                .tokenUrl(server.baseUrl() + "/oauth/token")
                .build();
        return new OAuthTokenClient(config, httpClient, objectMapper, clock);
    }

    // ========== Code Exchange ==========

    @Test
    void testExchangeCode_jsonBodyWithState() throws Exception {
        server.enqueueJson(200, "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3600}");

        OAuthCredentials credentials = anthropicClient().exchangeCode("the-code", "the-verifier", "the-state");

        assertEquals("at", credentials.getAccessToken());
        assertEquals("rt", credentials.getRefreshToken());
        assertEquals(NOW.plusSeconds(3600 - 300), credentials.getExpiresAt());

        FakeBackendServer.RecordedRequest request = server.getRequest(0);
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/oauth/token", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
        JsonNode body = objectMapper.readTree(request.getBody());
        assertEquals("authorization_code", body.path("grant_type").asText());
        assertEquals("the-code", body.path("code").asText());
        assertEquals("the-verifier", body.path("code_verifier").asText());
        assertEquals("the-state", body.path("state").asText());
        assertEquals("https://console.anthropic.com/oauth/code/callback", body.path("redirect_uri").asText());
    }

    @Test
    void testExchangeCode_formBodyAndAccountIdFromToken() throws Exception {
        String jwt = CredentialFilesTest.jwtWithAccount("acct-42");
        server.enqueueJson(200, "{\"access_token\":\"" + jwt + "\",\"refresh_token\":\"rt\",\"expires_in\":864000}");

        OAuthCredentials credentials = codexClient().exchangeCode("the-code", "the-verifier", "the-state");

        assertEquals("acct-42", credentials.getAccountId());
        FakeBackendServer.RecordedRequest request = server.getRequest(0);
        assertEquals("application/x-www-form-urlencoded", request.getHeader("Content-Type"));
        assertTrue(request.getBody().contains("grant_type=authorization_code"));
        assertTrue(request.getBody().contains("code_verifier=the-verifier"));
        assertTrue(request.getBody().contains("redirect_uri=http%3A%2F%2Flocalhost%3A1455%2Fauth%2Fcallback"));
        assertFalse(request.getBody().contains("state="));
    }

    @Test
    void testExchangeCode_rejected() {
        server.enqueueJson(400, "{\"error\":\"invalid_grant\"}");

        AuthenticationException e = assertThrows(AuthenticationException.class,
                () -> anthropicClient().exchangeCode("bad", "verifier", "state"));

        assertEquals(AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED, e.getReason());
        assertTrue(e.getMessage().contains("400"));
    }

    @Test
    void testExchangeCode_missingExpiresIn() {
        server.enqueueJson(200, "{\"access_token\":\"at\"}");

        AuthenticationException e = assertThrows(AuthenticationException.class,
                () -> anthropicClient().exchangeCode("code", "verifier", "state"));
        assertEquals(AuthenticationException.Reason.TOKEN_EXCHANGE_FAILED, e.getReason());
    }

    // ========== Refresh ==========

    @Test
    void testRefresh_keepsRefreshTokenWhenOmitted() throws Exception {
        server.enqueueJson(200, "{\"access_token\":\"new-at\",\"expires_in\":3600}");
        OAuthCredentials current = new OAuthCredentials("old-at", "old-rt", NOW, "acct");

        OAuthCredentials refreshed = anthropicClient().refresh(current);

        assertEquals("new-at", refreshed.getAccessToken());
        assertEquals("old-rt", refreshed.getRefreshToken());
        assertEquals("acct", refreshed.getAccountId());

        JsonNode body = objectMapper.readTree(server.getRequest(0).getBody());
        assertEquals("refresh_token", body.path("grant_type").asText());
        assertEquals("old-rt", body.path("refresh_token").asText());
    }

    @Test
    void testRefresh_rotatedRefreshToken() throws Exception {
        server.enqueueJson(200, "{\"access_token\":\"new-at\",\"refresh_token\":\"new-rt\",\"expires_in\":3600}");

        OAuthCredentials refreshed = codexClient().refresh(new OAuthCredentials("old-at", "old-rt", NOW, "acct"));

        assertEquals("new-rt", refreshed.getRefreshToken());
        assertEquals("acct", refreshed.getAccountId());
    }

    @Test
    void testRefresh_rejectedIsFatal() {
        server.enqueueJson(401, "{\"error\":\"invalid_grant\"}");

        TokenRefreshException e = assertThrows(TokenRefreshException.class,
                () -> anthropicClient().refresh(new OAuthCredentials("at", "rt", NOW, null)));

        assertFalse(e.isRetryable());
        assertEquals(401, e.getStatusCode());
        assertTrue(e.getResponseBody().contains("invalid_grant"));
    }

    @Test
    void testRefresh_noRefreshToken() {
        TokenRefreshException e = assertThrows(TokenRefreshException.class,
                () -> anthropicClient().refresh(new OAuthCredentials("at", null, NOW, null)));

        assertFalse(e.isRetryable());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void testRefresh_networkFailureIsRetryable() {
        OAuthClientConfig config = OAuthClientConfig.anthropic().toBuilder()
                .tokenUrl(server.baseUrl() + "/v1/oauth/token")
                .build();
        OAuthTokenClient client = new OAuthTokenClient(config, httpClient, objectMapper, clock);
        server.close();

        TokenRefreshException e = assertThrows(TokenRefreshException.class,
                () -> client.refresh(new OAuthCredentials("at", "rt", NOW, null)));
        assertTrue(e.isRetryable());
    }

    // ========== Encoding ==========

    @Test
    void testFormEncode() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("a", "1 2");
        params.put("b", "x&y=z");

        assertEquals("a=1+2&b=x%26y%3Dz", OAuthTokenClient.formEncode(params));
    }
}
