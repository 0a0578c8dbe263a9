package io.github.barebone.llm.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.barebone.llm.gateway.BackendId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for a backend adapter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProviderConfig {

    private final BackendId backendId;
    private final String apiKey;
    private final String apiBaseUrl;
    private final String defaultModel;
    private final Integer maxTokens;
    private final Double temperature;
    private final Map<String, String> customHeaders;
    private final boolean enabled;
    private final Integer requestTimeoutSeconds;

    private ProviderConfig(Builder builder) {
        this.backendId = builder.backendId;
        this.apiKey = builder.apiKey;
        this.apiBaseUrl = builder.apiBaseUrl;
        this.defaultModel = builder.defaultModel;
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.customHeaders = builder.customHeaders != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.customHeaders)) :
                Collections.emptyMap();
        this.enabled = builder.enabled;
        this.requestTimeoutSeconds = builder.requestTimeoutSeconds;
    }

    public BackendId getBackendId() {
        return backendId;
    }

    /**
     * API key; null for backends reached through OAuth
     */
    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isEmpty();
    }

    /**
     * Base URL for API calls, overriding the backend's public endpoint
     */
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    /**
     * Extra headers sent with every request
     */
    public Map<String, String> getCustomHeaders() {
        return customHeaders;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Time allowed until response headers arrive
     */
    public Integer getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new builder with values from this config.
     */
    public Builder toBuilder() {
        return new Builder()
                .backendId(this.backendId)
                .apiKey(this.apiKey)
                .apiBaseUrl(this.apiBaseUrl)
                .defaultModel(this.defaultModel)
                .maxTokens(this.maxTokens)
                .temperature(this.temperature)
                .customHeaders(this.customHeaders)
                .enabled(this.enabled)
                .requestTimeoutSeconds(this.requestTimeoutSeconds);
    }

    @Override
    public String toString() {
        return "ProviderConfig{" +
                "backendId=" + backendId +
                ", apiKey=" + (hasApiKey() ? "***" : "none") +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", defaultModel='" + defaultModel + '\'' +
                ", enabled=" + enabled +
                '}';
    }

    public static class Builder {
        private BackendId backendId;
        private String apiKey;
        private String apiBaseUrl;
        private String defaultModel;
        private Integer maxTokens;
        private Double temperature;
        private Map<String, String> customHeaders;
        private boolean enabled = true;
        private Integer requestTimeoutSeconds;

        public Builder backendId(BackendId backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder customHeaders(Map<String, String> customHeaders) {
            this.customHeaders = customHeaders;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder requestTimeoutSeconds(Integer requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(this);
        }
    }
}
