package io.github.barebone.llm.gateway.providers.stream;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.gateway.providers.EventStream;
import io.github.barebone.llm.gateway.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

/**
 * Pulls server-sent events from an HTTP body and feeds them through a normalizer.
 * Reading stops at the terminal event; the body is closed then, or earlier by {@link #close()}.
 */
public class SseEventStream implements EventStream {

    private static final Logger logger = LoggerFactory.getLogger(SseEventStream.class);

    private final String backendId;
    private final InputStream body;
    private final SseParser parser;
    private final StreamNormalizer normalizer;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();

    private volatile boolean closed;
    private boolean exhausted;

    public SseEventStream(String backendId, InputStream body, StreamNormalizer normalizer) {
        this.backendId = backendId;
        this.body = body;
        this.parser = new SseParser(body);
        this.normalizer = normalizer;
    }

    @Override
    public boolean hasNext() throws GatewayException {
        while (pending.isEmpty() && !exhausted) {
            if (closed) {
                throw new ProviderException(backendId, "Stream from " + backendId + " was closed", -1, false);
            }
            SseEvent event;
            try {
                event = parser.nextEvent();
            } catch (IOException e) {
                exhausted = true;
                close();
                throw new ProviderException(backendId, "Reading stream from " + backendId + " failed", -1, true, e);
            }

            try {
                if (event == null) {
                    exhausted = true;
                    normalizer.finish(pending::add);
                } else {
                    normalizer.accept(event, pending::add);
                    if (normalizer.isDone()) {
                        exhausted = true;
                    }
                }
            } catch (GatewayException e) {
                exhausted = true;
                close();
                throw e;
            }

            if (exhausted) {
                close();
            }
        }
        return !pending.isEmpty();
    }

    @Override
    public StreamEvent next() throws GatewayException {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream from " + backendId + " has ended");
        }
        return pending.poll();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            body.close();
        } catch (IOException e) {
            logger.debug("Error closing {} stream: {}", backendId, e.getMessage());
        }
    }
}
