package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;

/**
 * Forward-only sequence of unified events for one turn.
 * <p>
 * Events arrive in the order the backend sent them and the last one is always
 * a {@link io.github.barebone.llm.events.TurnCompleted}. A stream cannot be
 * restarted. Closing it before the end releases the HTTP connection at once.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Blocks until another event is available or the stream has ended.
     */
    boolean hasNext() throws GatewayException;

    /**
     * Returns the next event.
     *
     * @throws java.util.NoSuchElementException if the stream has ended
     */
    StreamEvent next() throws GatewayException;

    /**
     * Aborts the stream and closes the underlying connection. Idempotent.
     */
    @Override
    void close();
}
