package io.github.barebone.llm.gateway.config;

import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.ProviderConfig;
import io.github.barebone.llm.gateway.providers.impl.ChatCompletionsAdapter;
import io.github.barebone.llm.gateway.providers.impl.CodexAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Gateway configuration: per-backend settings, default backend, credential
 * file location and timeouts.
 * <p>
 * {@link #load()} reads, in increasing priority, the classpath resource
 * {@value #RESOURCE_NAME}, environment variables and {@code llm.gateway.*}
 * system properties. Keys look like {@code llm.gateway.anthropic.api-key} or
 * {@code llm.gateway.default-backend}.
 */
public final class GatewayConfig {

    private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String RESOURCE_NAME = "llm-gateway.properties";
    public static final String PREFIX = "llm.gateway.";

    static final String KEY_DEFAULT_BACKEND = PREFIX + "default-backend";
    static final String KEY_HOME = PREFIX + "home";
    static final String KEY_CREDENTIALS_FILE = PREFIX + "credentials-file";
    static final String KEY_CALLBACK_TIMEOUT_MS = PREFIX + "callback-timeout-ms";
    static final String KEY_REQUEST_TIMEOUT_MS = PREFIX + "request-timeout-ms";
    static final String KEY_APP_NAME = PREFIX + "app-name";
    static final String KEY_ORIGINATOR = PREFIX + "originator";

    /**
     * Environment variables and the keys they set
     */
    static final Map<String, String> ENVIRONMENT_KEYS;

    static {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ANTHROPIC_API_KEY", PREFIX + "anthropic.api-key");
        env.put("OPENROUTER_API_KEY", PREFIX + "openrouter.api-key");
        env.put("LLM_GATEWAY_DEFAULT_BACKEND", KEY_DEFAULT_BACKEND);
        env.put("LLM_GATEWAY_CREDENTIALS_FILE", KEY_CREDENTIALS_FILE);
        env.put("LLM_GATEWAY_REQUEST_TIMEOUT_MS", KEY_REQUEST_TIMEOUT_MS);
        ENVIRONMENT_KEYS = Collections.unmodifiableMap(env);
    }

    private final Map<BackendId, ProviderConfig> providers;
    private final BackendId defaultBackend;
    private final Path homeDirectory;
    private final Path credentialFile;
    private final Duration callbackTimeout;
    private final Duration requestTimeout;
    private final String appName;
    private final String originator;

    private GatewayConfig(Builder builder) {
        Map<BackendId, ProviderConfig> configs = new EnumMap<>(BackendId.class);
        for (BackendId backend : BackendId.values()) {
            ProviderConfig config = builder.providers.get(backend);
            configs.put(backend, config != null ? config : ProviderConfig.builder().backendId(backend).build());
        }
        this.providers = Collections.unmodifiableMap(configs);
        this.defaultBackend = builder.defaultBackend;
        this.homeDirectory = builder.homeDirectory != null ?
                builder.homeDirectory : Paths.get(System.getProperty("user.home"));
        this.credentialFile = builder.credentialFile != null ?
                builder.credentialFile : homeDirectory.resolve(".llm-gateway").resolve("credentials.json");
        this.callbackTimeout = builder.callbackTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.appName = builder.appName;
        this.originator = builder.originator;
    }

    public ProviderConfig getProviderConfig(BackendId backend) {
        return providers.get(backend);
    }

    public Map<BackendId, ProviderConfig> getProviderConfigs() {
        return providers;
    }

    /**
     * Backend for model ids no routing rule matches, or null
     */
    public BackendId getDefaultBackend() {
        return defaultBackend;
    }

    /**
     * Home directory under which the CLI credential files are looked up
     */
    public Path getHomeDirectory() {
        return homeDirectory;
    }

    public Path getCredentialFile() {
        return credentialFile;
    }

    public Duration getCallbackTimeout() {
        return callbackTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public String getAppName() {
        return appName;
    }

    public String getOriginator() {
        return originator;
    }

    // ========== Loading ==========

    /**
     * Loads the classpath resource, environment and system properties.
     */
    public static GatewayConfig load() throws IOException {
        Properties file = new Properties();
        try (InputStream in = GatewayConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                file.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                logger.debug("Loaded {} from classpath", RESOURCE_NAME);
            }
        }
        return fromSources(file, System.getenv(), System.getProperties());
    }

    /**
     * Loads a properties file, then applies environment and system properties.
     */
    public static GatewayConfig load(Path propertiesFile) throws IOException {
        Properties file = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            file.load(reader);
        }
        logger.debug("Loaded configuration from {}", propertiesFile);
        return fromSources(file, System.getenv(), System.getProperties());
    }

    /**
     * Merges the sources, later ones overriding earlier ones.
     */
    static GatewayConfig fromSources(Properties file, Map<String, String> environment, Properties system) {
        Properties merged = new Properties();
        merged.putAll(file);
        ENVIRONMENT_KEYS.forEach((variable, key) -> {
            String value = environment.get(variable);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
        });
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                merged.setProperty(name, system.getProperty(name));
            }
        }
        return fromProperties(merged);
    }

    /**
     * Builds a configuration from {@code llm.gateway.*} properties.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static GatewayConfig fromProperties(Properties properties) {
        Builder builder = builder();

        String defaultBackend = trimmed(properties, KEY_DEFAULT_BACKEND);
        if (defaultBackend != null) {
            builder.defaultBackend(BackendId.fromId(defaultBackend).orElseThrow(() ->
                    new IllegalArgumentException("Unknown backend in " + KEY_DEFAULT_BACKEND + ": " + defaultBackend)));
        }

        String home = trimmed(properties, KEY_HOME);
        if (home != null) {
            builder.homeDirectory(Paths.get(home));
        }
        String credentials = trimmed(properties, KEY_CREDENTIALS_FILE);
        if (credentials != null) {
            builder.credentialFile(Paths.get(credentials));
        }

        Long callbackMs = parseLong(properties, KEY_CALLBACK_TIMEOUT_MS);
        if (callbackMs != null) {
            builder.callbackTimeout(Duration.ofMillis(callbackMs));
        }
        Long requestMs = parseLong(properties, KEY_REQUEST_TIMEOUT_MS);
        if (requestMs != null) {
            builder.requestTimeout(Duration.ofMillis(requestMs));
        }

        String appName = trimmed(properties, KEY_APP_NAME);
        if (appName != null) {
            builder.appName(appName);
        }
        String originator = trimmed(properties, KEY_ORIGINATOR);
        if (originator != null) {
            builder.originator(originator);
        }

        for (BackendId backend : BackendId.values()) {
            builder.provider(providerConfig(backend, properties));
        }

        return builder.build();
    }

    private static ProviderConfig providerConfig(BackendId backend, Properties properties) {
        String prefix = PREFIX + backend.getId() + ".";
        ProviderConfig.Builder config = ProviderConfig.builder().backendId(backend);

        config.apiKey(trimmed(properties, prefix + "api-key"));
        config.apiBaseUrl(trimmed(properties, prefix + "base-url"));
        config.defaultModel(trimmed(properties, prefix + "model"));

        Long maxTokens = parseLong(properties, prefix + "max-tokens");
        if (maxTokens != null) {
            config.maxTokens(maxTokens.intValue());
        }
        String temperature = trimmed(properties, prefix + "temperature");
        if (temperature != null) {
            try {
                config.temperature(Double.parseDouble(temperature));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + prefix + "temperature: " + temperature, e);
            }
        }
        Long timeoutSeconds = parseLong(properties, prefix + "timeout-seconds");
        if (timeoutSeconds != null) {
            config.requestTimeoutSeconds(timeoutSeconds.intValue());
        }
        String enabled = trimmed(properties, prefix + "enabled");
        if (enabled != null) {
            config.enabled(Boolean.parseBoolean(enabled));
        }
        return config.build();
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Long parseLong(Properties properties, String key) {
        String value = trimmed(properties, key);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "defaultBackend=" + defaultBackend +
                ", credentialFile=" + credentialFile +
                ", providers=" + providers.values() +
                '}';
    }

    public static class Builder {
        private final Map<BackendId, ProviderConfig> providers = new EnumMap<>(BackendId.class);
        private BackendId defaultBackend;
        private Path homeDirectory;
        private Path credentialFile;
        private Duration callbackTimeout = Duration.ofMillis(GatewayConstants.DEFAULT_CALLBACK_TIMEOUT_MS);
        private Duration requestTimeout = Duration.ofMillis(GatewayConstants.DEFAULT_REQUEST_TIMEOUT_MS);
        private String appName = ChatCompletionsAdapter.DEFAULT_APP_NAME;
        private String originator = CodexAdapter.DEFAULT_ORIGINATOR;

        public Builder provider(ProviderConfig config) {
            this.providers.put(config.getBackendId(), config);
            return this;
        }

        public Builder defaultBackend(BackendId defaultBackend) {
            this.defaultBackend = defaultBackend;
            return this;
        }

        public Builder homeDirectory(Path homeDirectory) {
            this.homeDirectory = homeDirectory;
            return this;
        }

        public Builder credentialFile(Path credentialFile) {
            this.credentialFile = credentialFile;
            return this;
        }

        public Builder callbackTimeout(Duration callbackTimeout) {
            this.callbackTimeout = callbackTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder originator(String originator) {
            this.originator = originator;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
