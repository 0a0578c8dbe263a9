package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.BackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps model ids to backend adapters.
 * <p>
 * Routing is a pure function of the model id, the registered adapters and the
 * default backend. Rules are tried in order and the first match wins; ids that
 * match no rule go to the default backend when one is set.
 */
public class Router {

    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    public static final List<RouteRule> RULES = List.of(
            RouteRule.namespace("anthropic/", BackendId.ANTHROPIC),
            RouteRule.namespace("openrouter/", BackendId.OPENROUTER),
            RouteRule.namespace("openai-codex/", BackendId.OPENAI_CODEX),
            RouteRule.namespace("codex/", BackendId.OPENAI_CODEX),
            RouteRule.family("claude-", BackendId.ANTHROPIC),
            RouteRule.family("gpt-5", BackendId.OPENAI_CODEX)
    );

    private final Map<BackendId, BackendAdapter> adapters = new ConcurrentHashMap<>();
    private volatile BackendId defaultBackend;

    public Router() {
    }

    public Router(BackendId defaultBackend) {
        this.defaultBackend = defaultBackend;
    }

    /**
     * Registers an adapter, replacing any previous adapter for the same backend.
     */
    public void register(BackendAdapter adapter) {
        adapters.put(adapter.getBackendId(), adapter);
        logger.info("Registered backend: {} ({})", adapter.getBackendId(), adapter.getDisplayName());
    }

    public void remove(BackendId backendId) {
        if (adapters.remove(backendId) != null) {
            logger.info("Removed backend: {}", backendId);
        }
    }

    public Optional<BackendAdapter> getAdapter(BackendId backendId) {
        return Optional.ofNullable(adapters.get(backendId));
    }

    public Collection<BackendAdapter> getAdapters() {
        return adapters.values();
    }

    /**
     * Backend used for ids no rule matches, or null if such ids are rejected
     */
    public BackendId getDefaultBackend() {
        return defaultBackend;
    }

    public void setDefaultBackend(BackendId defaultBackend) {
        this.defaultBackend = defaultBackend;
        logger.info("Default backend set to: {}", defaultBackend);
    }

    /**
     * Resolves a model id to the adapter that serves it.
     *
     * @throws UnknownModelException         if the id is blank or a bare prefix
     * @throws NoProviderConfiguredException if the backend it names has no adapter
     */
    public Route route(String modelId) throws UnknownModelException, NoProviderConfiguredException {
        if (modelId == null || modelId.isBlank()) {
            throw new UnknownModelException(modelId, "Model id is empty");
        }

        for (RouteRule rule : RULES) {
            if (rule.matches(modelId)) {
                String localModelId = rule.localModelId(modelId);
                if (localModelId.isBlank()) {
                    throw new UnknownModelException(modelId, "No model named after prefix '" + rule.getPrefix() + "'");
                }
                return resolve(rule.getBackend(), modelId, localModelId);
            }
        }

        BackendId fallback = defaultBackend;
        if (fallback == null) {
            throw new NoProviderConfiguredException(null, modelId,
                    "No backend matches model '" + modelId + "' and no default backend is configured");
        }
        return resolve(fallback, modelId, modelId);
    }

    private Route resolve(BackendId backendId, String modelId, String localModelId)
            throws NoProviderConfiguredException {
        BackendAdapter adapter = adapters.get(backendId);
        if (adapter == null) {
            throw new NoProviderConfiguredException(backendId.getId(), modelId,
                    "No " + backendId.getDisplayName() + " backend configured for model '" + modelId + "'");
        }
        logger.debug("Routed {} to {} as {}", modelId, backendId, localModelId);
        return new Route(backendId, adapter, localModelId);
    }
}
