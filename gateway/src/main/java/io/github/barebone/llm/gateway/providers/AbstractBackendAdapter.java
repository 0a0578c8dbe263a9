package io.github.barebone.llm.gateway.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP plumbing shared by the backend adapters: request dispatch with
 * authorization, one retry after a 401 for refreshable credentials, and
 * mapping of error statuses to typed exceptions.
 */
public abstract class AbstractBackendAdapter implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(AbstractBackendAdapter.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 120;

    protected final ProviderConfig config;
    protected final RequestAuthorizer authorizer;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractBackendAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                                     HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.authorizer = authorizer;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Public endpoint used when the configuration does not override it
     */
    protected abstract String defaultApiBase();

    /**
     * Model used when neither the request nor the configuration names one
     */
    protected abstract String defaultModel();

    /**
     * Adds the backend's fixed headers (versions, betas, client identification).
     */
    protected abstract void addBackendHeaders(HttpRequest.Builder builder, boolean streaming);

    @Override
    public String getDisplayName() {
        return getBackendId().getDisplayName();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && authorizer.isConfigured();
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();
        if (!authorizer.isOAuth() && !config.hasApiKey()) {
            result.addError("apiKey", "API key is required");
        }
        if (config.getApiBaseUrl() != null && !config.getApiBaseUrl().startsWith("http")) {
            result.addError("apiBaseUrl", "Base URL must be an http(s) URL");
        }
        if (config.getMaxTokens() != null && config.getMaxTokens() <= 0) {
            result.addError("maxTokens", "Max tokens must be positive");
        }
        return result.build();
    }

    public RequestAuthorizer getAuthorizer() {
        return authorizer;
    }

    protected String apiBase() {
        String base = config.getApiBaseUrl() != null ? config.getApiBaseUrl() : defaultApiBase();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    protected String resolveModel(CompletionRequest request) {
        if (request.getModel() != null && !request.getModel().isEmpty()) {
            return request.getModel();
        }
        return config.getDefaultModel() != null ? config.getDefaultModel() : defaultModel();
    }

    protected int resolveMaxTokens(CompletionRequest request) {
        if (request.getMaxTokens() != null) {
            return request.getMaxTokens();
        }
        return config.getMaxTokens() != null ? config.getMaxTokens() : GatewayConstants.DEFAULT_MAX_TOKENS;
    }

    protected Double resolveTemperature(CompletionRequest request) {
        return request.getTemperature() != null ? request.getTemperature() : config.getTemperature();
    }

    /**
     * POSTs a JSON body and returns the successful response with its body unread.
     * A 401 is retried once when the authorizer could refresh its credentials.
     */
    protected HttpResponse<InputStream> post(String path, ObjectNode payload, boolean streaming) throws GatewayException {
        String backendId = getBackendId().getId();
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(backendId, "Failed to build " + backendId + " request", -1, false, e);
        }

        boolean retried = false;
        while (true) {
            HttpRequest.Builder builder = newRequest(path, streaming)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            String secret = authorizer.authorize(builder);

            HttpResponse<InputStream> response = send(builder.build());
            int statusCode = response.statusCode();
            if (statusCode >= 200 && statusCode < 300) {
                return response;
            }

            String errorBody = readBody(response.body());
            if (statusCode == 401 && !retried && authorizer.onUnauthorized(secret)) {
                logger.info("{} answered 401, retrying with refreshed credentials", backendId);
                retried = true;
                continue;
            }
            throw handleErrorResponse(statusCode, errorBody, response.headers());
        }
    }

    /**
     * GETs a JSON document.
     */
    protected JsonNode getJson(String path) throws GatewayException {
        HttpRequest.Builder builder = newRequest(path, false).GET();
        authorizer.authorize(builder);
        HttpResponse<InputStream> response = send(builder.build());
        String body = readBody(response.body());
        if (response.statusCode() != 200) {
            throw handleErrorResponse(response.statusCode(), body, response.headers());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getBackendId().getId(),
                    "Failed to parse " + getBackendId() + " response", response.statusCode(), false, e);
        }
    }

    private HttpRequest.Builder newRequest(String path, boolean streaming) {
        int timeout = config.getRequestTimeoutSeconds() != null ?
                config.getRequestTimeoutSeconds() : DEFAULT_REQUEST_TIMEOUT_SECONDS;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(apiBase() + path))
                .timeout(Duration.ofSeconds(timeout));
        addBackendHeaders(builder, streaming);
        config.getCustomHeaders().forEach(builder::header);
        return builder;
    }

    private HttpResponse<InputStream> send(HttpRequest request) throws ProviderException {
        String backendId = getBackendId().getId();
        try {
            logger.debug("{} {}", request.method(), request.uri());
            return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new ProviderException(backendId, "Failed to communicate with " + backendId, -1, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(backendId, "Request to " + backendId + " was interrupted", -1, false, e);
        }
    }

    protected String readBody(InputStream body) throws ProviderException {
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProviderException(getBackendId().getId(),
                    "Failed to read " + getBackendId() + " response", -1, true, e);
        }
    }

    /**
     * Handles error responses from the backend.
     */
    protected ProviderException handleErrorResponse(int statusCode, String responseBody, HttpHeaders headers) {
        String backendId = getBackendId().getId();
        String message = extractErrorMessage(responseBody);

        if (statusCode == 401 || statusCode == 403) {
            return new ProviderException(backendId, "Authentication failed: " + message, statusCode, false);
        } else if (statusCode == 429) {
            return new RateLimitedException(backendId, "Rate limit exceeded: " + message,
                    parseRetryAfter(headers).orElse(null));
        } else if (statusCode >= 500) {
            return new ProviderException(backendId, "Server error: " + message, statusCode, true);
        } else if (statusCode == 400) {
            return new ProviderException(backendId, "Bad request: " + message, statusCode, false);
        } else {
            return new ProviderException(backendId,
                    "API error (" + statusCode + "): " + message, statusCode, false);
        }
    }

    protected String extractErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return "no details";
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode error = root.path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.has("message")) {
                return error.path("message").asText();
            }
            if (root.has("detail")) {
                JsonNode detail = root.path("detail");
                return detail.isTextual() ? detail.asText() : detail.path("message").asText(detail.toString());
            }
            if (root.has("message")) {
                return root.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            // not JSON, use the raw body
        }
        return responseBody.length() > 500 ? responseBody.substring(0, 500) : responseBody;
    }

    static Optional<Duration> parseRetryAfter(HttpHeaders headers) {
        Optional<String> value = headers.firstValue("retry-after");
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.ofMillis((long) (Double.parseDouble(value.get().trim()) * 1000)));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by these backends
            return Optional.empty();
        }
    }

    /**
     * Parses tool arguments from a unary response. Invalid JSON yields an empty map.
     */
    protected Map<String, Object> parseToolArguments(JsonNode arguments, String toolName) {
        JsonNode node = arguments;
        if (arguments.isTextual()) {
            String json = arguments.asText();
            if (json.isBlank()) {
                return Collections.emptyMap();
            }
            try {
                node = objectMapper.reader()
                        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                        .readTree(json);
            } catch (JsonProcessingException e) {
                logger.warn("Malformed arguments for tool '{}' from {}, using empty arguments", toolName, getBackendId());
                return Collections.emptyMap();
            }
        }
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return objectMapper.convertValue(node, ARGUMENTS_TYPE);
    }

    /**
     * Serializes tool arguments as the JSON string some dialects expect.
     */
    protected String argumentsToJson(Map<String, Object> arguments) throws ProviderException {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getBackendId().getId(), "Tool arguments are not serializable", -1, false, e);
        }
    }
}
