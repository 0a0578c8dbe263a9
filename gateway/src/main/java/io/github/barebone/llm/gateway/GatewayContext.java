package io.github.barebone.llm.gateway;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ModelInfo;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.auth.CredentialStore;
import io.github.barebone.llm.gateway.auth.OAuthClientConfig;
import io.github.barebone.llm.gateway.auth.OAuthCredentials;
import io.github.barebone.llm.gateway.auth.OAuthFlow;
import io.github.barebone.llm.gateway.auth.OAuthTokenClient;
import io.github.barebone.llm.gateway.auth.TokenManager;
import io.github.barebone.llm.gateway.config.GatewayConfig;
import io.github.barebone.llm.gateway.hooks.ToolCallHooks;
import io.github.barebone.llm.gateway.providers.ApiKeyAuthorizer;
import io.github.barebone.llm.gateway.providers.BackendAdapter;
import io.github.barebone.llm.gateway.providers.CompletionRequest;
import io.github.barebone.llm.gateway.providers.EventStream;
import io.github.barebone.llm.gateway.providers.OAuthBearerAuthorizer;
import io.github.barebone.llm.gateway.providers.ProviderConfig;
import io.github.barebone.llm.gateway.providers.StreamDrainer;
import io.github.barebone.llm.gateway.providers.StreamingCallback;
import io.github.barebone.llm.gateway.providers.impl.AnthropicAdapter;
import io.github.barebone.llm.gateway.providers.impl.ChatCompletionsAdapter;
import io.github.barebone.llm.gateway.providers.impl.CodexAdapter;
import io.github.barebone.llm.gateway.routing.NoProviderConfiguredException;
import io.github.barebone.llm.gateway.routing.Route;
import io.github.barebone.llm.gateway.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Central context for the gateway.
 * Holds the shared HTTP client, credential store, token managers and router,
 * and provides lifecycle management. Create one per application and close it
 * on shutdown.
 */
public class GatewayContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GatewayContext.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 30;

    private final GatewayConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService executorService;
    private final CredentialStore credentialStore;
    private final Map<BackendId, OAuthTokenClient> tokenClients = new EnumMap<>(BackendId.class);
    private final Map<BackendId, TokenManager> tokenManagers = new EnumMap<>(BackendId.class);
    private final Router router;
    private final ToolCallHooks toolCallHooks;

    private volatile boolean running = false;

    public GatewayContext(GatewayConfig config) {
        this(config,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS)).build(),
                createObjectMapper(),
                Clock.systemUTC());
    }

    public GatewayContext(GatewayConfig config, HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        this(config, httpClient, objectMapper, clock,
                CredentialStore.standard(config.getHomeDirectory(), config.getCredentialFile(), objectMapper, clock));
    }

    public GatewayContext(GatewayConfig config, HttpClient httpClient, ObjectMapper objectMapper, Clock clock,
                          CredentialStore credentialStore) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.credentialStore = credentialStore;

        // Worker threads for timed completions
        AtomicInteger threadCount = new AtomicInteger();
        this.executorService = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "LLMGateway-Worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        // OAuth clients and token managers for the subscription backends
        registerTokenManager(OAuthClientConfig.anthropic());
        registerTokenManager(OAuthClientConfig.openAiCodex(config.getOriginator()));
        logger.debug("Token managers initialized");

        this.router = new Router(config.getDefaultBackend());
        for (BackendId backend : BackendId.values()) {
            createAdapter(backend).ifPresent(router::register);
        }

        this.toolCallHooks = new ToolCallHooks();

        this.running = true;
        logger.info("LLM Gateway context started (default backend: {})",
                config.getDefaultBackend() != null ? config.getDefaultBackend() : "none");
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    private void registerTokenManager(OAuthClientConfig clientConfig) {
        BackendId backend = clientConfig.getBackendId();
        OAuthTokenClient tokenClient = new OAuthTokenClient(clientConfig, httpClient, objectMapper, clock);
        tokenClients.put(backend, tokenClient);
        tokenManagers.put(backend, TokenManager.load(backend, credentialStore, tokenClient, clock));
    }

    /**
     * Creates the adapter for a backend when it is enabled and has credentials.
     */
    private Optional<BackendAdapter> createAdapter(BackendId backend) {
        ProviderConfig providerConfig = config.getProviderConfig(backend);
        if (!providerConfig.isEnabled()) {
            logger.debug("Backend {} is disabled", backend);
            return Optional.empty();
        }

        TokenManager tokenManager = tokenManagers.get(backend);
        switch (backend) {
            case ANTHROPIC:
                if (providerConfig.hasApiKey()) {
                    return Optional.of(new AnthropicAdapter(providerConfig,
                            ApiKeyAuthorizer.header("x-api-key", providerConfig.getApiKey()), httpClient, objectMapper));
                }
                if (tokenManager.hasCredentials()) {
                    return Optional.of(new AnthropicAdapter(providerConfig,
                            new OAuthBearerAuthorizer(tokenManager), httpClient, objectMapper));
                }
                break;
            case OPENROUTER:
                if (providerConfig.hasApiKey()) {
                    return Optional.of(new ChatCompletionsAdapter(providerConfig,
                            ApiKeyAuthorizer.bearer(providerConfig.getApiKey()), httpClient, objectMapper,
                            config.getAppName()));
                }
                break;
            case OPENAI_CODEX:
                if (tokenManager.hasCredentials()) {
                    return Optional.of(new CodexAdapter(providerConfig,
                            new OAuthBearerAuthorizer(tokenManager, CodexAdapter.ACCOUNT_ID_HEADER),
                            httpClient, objectMapper, config.getOriginator()));
                }
                break;
            default:
                break;
        }
        logger.debug("No credentials for backend {}, not registering it", backend);
        return Optional.empty();
    }

    // ========== Completions ==========

    /**
     * Routes the request by model id and waits for the whole turn.
     */
    public TurnCompleted complete(CompletionRequest request) throws GatewayException {
        Route route = router.route(request.getModel());
        return route.getAdapter().complete(request.withModel(route.getLocalModelId()));
    }

    /**
     * Like {@link #complete(CompletionRequest)}, but fails with
     * {@link GatewayTimeoutException} if the turn takes longer than {@code timeout},
     * counted from before the request is sent.
     */
    public TurnCompleted complete(CompletionRequest request, Duration timeout) throws GatewayException {
        Route route = router.route(request.getModel());
        CompletionRequest routed = request.withModel(route.getLocalModelId());
        return StreamDrainer.drain(() -> route.getAdapter().stream(routed),
                route.getBackendId().getId(), timeout, executorService);
    }

    /**
     * Routes the request by model id and opens an event stream. The caller must close it.
     */
    public EventStream stream(CompletionRequest request) throws GatewayException {
        Route route = router.route(request.getModel());
        return route.getAdapter().stream(request.withModel(route.getLocalModelId()));
    }

    /**
     * Streams into a callback. Routing failures are reported to the callback too.
     */
    public void stream(CompletionRequest request, StreamingCallback callback) {
        Route route;
        try {
            route = router.route(request.getModel());
        } catch (GatewayException e) {
            callback.onError(e);
            return;
        }
        route.getAdapter().streamTo(request.withModel(route.getLocalModelId()), callback);
    }

    public List<ModelInfo> listModels(BackendId backend) throws GatewayException {
        Optional<BackendAdapter> adapter = router.getAdapter(backend);
        if (adapter.isEmpty()) {
            throw new NoProviderConfiguredException(
                    backend.getId(), null, "No " + backend.getDisplayName() + " backend configured");
        }
        return adapter.get().listModels();
    }

    // ========== Login ==========

    /**
     * Runs the OAuth login for a subscription backend and installs the result.
     * Loopback backends wait for the browser redirect; manual-code backends read
     * the pasted {@code code#state} from {@code pastedCode}.
     *
     * @param urlListener receives the authorization URL to open in a browser
     */
    public OAuthCredentials login(BackendId backend, Consumer<String> urlListener, Supplier<String> pastedCode)
            throws GatewayException {
        OAuthTokenClient tokenClient = tokenClients.get(backend);
        if (tokenClient == null) {
            throw new IllegalArgumentException(backend.getDisplayName() + " does not support OAuth login");
        }

        OAuthFlow flow = new OAuthFlow(tokenClient);
        OAuthCredentials credentials;
        if (tokenClient.getConfig().getRedirectMode() == OAuthClientConfig.RedirectMode.MANUAL_CODE) {
            credentials = flow.login(urlListener, pastedCode);
        } else {
            credentials = flow.login(urlListener, config.getCallbackTimeout());
        }

        tokenManagers.get(backend).setCredentials(credentials);
        if (router.getAdapter(backend).isEmpty()) {
            createAdapter(backend).ifPresent(router::register);
        }
        logger.info("Login completed for {}", backend);
        return credentials;
    }

    // ========== Accessors ==========

    public GatewayConfig getConfig() {
        return config;
    }

    public Router getRouter() {
        return router;
    }

    public CredentialStore getCredentialStore() {
        return credentialStore;
    }

    public Optional<TokenManager> getTokenManager(BackendId backend) {
        return Optional.ofNullable(tokenManagers.get(backend));
    }

    public ToolCallHooks getToolCallHooks() {
        return toolCallHooks;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Shuts down the context and releases resources.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }

        running = false;
        logger.info("Shutting down LLM Gateway context...");

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                logger.warn("Executor service did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("LLM Gateway context shutdown complete");
    }
}
