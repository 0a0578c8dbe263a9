package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ModelInfo;
import io.github.barebone.llm.common.model.ValidationResult;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.ToolCallStarted;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.BackendId;

import java.util.Collections;
import java.util.List;

/**
 * Core interface for backend implementations, one per wire dialect.
 */
public interface BackendAdapter {

    BackendId getBackendId();

    /**
     * Display name for logs and listings
     */
    String getDisplayName();

    /**
     * Check if the adapter has what it needs to make calls (API key or credentials)
     */
    boolean isAvailable();

    /**
     * Send a request and wait for the whole turn
     */
    TurnCompleted complete(CompletionRequest request) throws GatewayException;

    /**
     * Send a request and return its events as they arrive
     */
    EventStream stream(CompletionRequest request) throws GatewayException;

    /**
     * Validate adapter configuration
     */
    ValidationResult validateConfig(ProviderConfig config);

    /**
     * Models the backend offers. Backends without a listing endpoint return an empty list.
     */
    default List<ModelInfo> listModels() throws GatewayException {
        return Collections.emptyList();
    }

    /**
     * Streams a request into a callback. Errors are reported to the callback, not thrown.
     */
    default void streamTo(CompletionRequest request, StreamingCallback callback) {
        try (EventStream events = stream(request)) {
            while (events.hasNext()) {
                StreamEvent event = events.next();
                if (event instanceof TextFragment) {
                    callback.onToken(((TextFragment) event).getText());
                } else if (event instanceof ToolCallStarted) {
                    callback.onToolCallStarted((ToolCallStarted) event);
                } else if (event instanceof ToolCallCompleted) {
                    callback.onToolCall((ToolCallCompleted) event);
                } else if (event instanceof TurnCompleted) {
                    callback.onComplete((TurnCompleted) event);
                }
            }
        } catch (GatewayException e) {
            callback.onError(e);
        }
    }
}
