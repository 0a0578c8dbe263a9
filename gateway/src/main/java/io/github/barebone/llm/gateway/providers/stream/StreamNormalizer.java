package io.github.barebone.llm.gateway.providers.stream;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;

import java.util.function.Consumer;

/**
 * Turns one backend's server-sent events into unified stream events.
 * A normalizer holds the state of a single turn and is not reusable.
 */
public interface StreamNormalizer {

    /**
     * Processes one server-sent event, passing any resulting events to the sink in order.
     *
     * @throws GatewayException if the backend reported an error or broke the protocol
     */
    void accept(SseEvent event, Consumer<StreamEvent> sink) throws GatewayException;

    /**
     * Called when the body ends. Emits the final event if the dialect allows ending here,
     * otherwise fails.
     */
    void finish(Consumer<StreamEvent> sink) throws GatewayException;

    /**
     * Whether the terminal event has been emitted
     */
    boolean isDone();
}
