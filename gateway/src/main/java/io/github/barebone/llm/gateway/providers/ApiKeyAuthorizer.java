package io.github.barebone.llm.gateway.providers;

import java.net.http.HttpRequest;

/**
 * Sends a static API key, either raw in a dedicated header or as a bearer token.
 */
public class ApiKeyAuthorizer implements RequestAuthorizer {

    private final String headerName;
    private final String prefix;
    private final String apiKey;

    public ApiKeyAuthorizer(String headerName, String prefix, String apiKey) {
        this.headerName = headerName;
        this.prefix = prefix != null ? prefix : "";
        this.apiKey = apiKey;
    }

    public static ApiKeyAuthorizer bearer(String apiKey) {
        return new ApiKeyAuthorizer("Authorization", "Bearer ", apiKey);
    }

    public static ApiKeyAuthorizer header(String headerName, String apiKey) {
        return new ApiKeyAuthorizer(headerName, "", apiKey);
    }

    @Override
    public String authorize(HttpRequest.Builder request) {
        request.header(headerName, prefix + apiKey);
        return apiKey;
    }

    @Override
    public boolean isOAuth() {
        return false;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isEmpty();
    }
}
