package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.GatewayTimeoutException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumes a stream to its terminal event, for callers that want the whole turn.
 */
public final class StreamDrainer {

    private StreamDrainer() {
    }

    /**
     * Reads the stream to the end and returns its {@link TurnCompleted}.
     */
    public static TurnCompleted drain(EventStream stream, String backendId) throws GatewayException {
        try (EventStream events = stream) {
            while (events.hasNext()) {
                StreamEvent event = events.next();
                if (event instanceof TurnCompleted) {
                    return (TurnCompleted) event;
                }
            }
        }
        throw new BackendProtocolException(backendId, "Stream from " + backendId + " ended without completing the turn");
    }

    /**
     * Opens an event stream. Used where opening the stream counts against a deadline.
     */
    @FunctionalInterface
    public interface StreamOpener {
        EventStream open() throws GatewayException;
    }

    /**
     * Drains the stream on the executor and fails if it takes longer than {@code timeout}.
     * On timeout the stream is closed, which releases the connection.
     */
    public static TurnCompleted drain(EventStream stream, String backendId, Duration timeout,
                                      ExecutorService executor) throws GatewayException {
        return drain(() -> stream, backendId, timeout, executor);
    }

    /**
     * Opens and drains a stream on the executor. The deadline covers the request,
     * the wait for response headers and any token refresh, not only the body.
     * A stream that opens after the deadline is closed straight away.
     */
    public static TurnCompleted drain(StreamOpener opener, String backendId, Duration timeout,
                                      ExecutorService executor) throws GatewayException {
        AtomicReference<EventStream> opened = new AtomicReference<>();
        AtomicBoolean abandoned = new AtomicBoolean();
        Future<TurnCompleted> future = executor.submit(() -> {
            EventStream stream = opener.open();
            opened.set(stream);
            if (abandoned.get()) {
                stream.close();
                throw new ProviderException(backendId, "Stream from " + backendId + " opened after the deadline",
                        -1, false);
            }
            return drain(stream, backendId);
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(opened, abandoned, future);
            throw new GatewayTimeoutException(backendId,
                    "Request to " + backendId + " did not complete within " + timeout.toMillis() + "ms", timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException) {
                throw (GatewayException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ProviderException(backendId, "Request to " + backendId + " failed", -1, false, cause);
        } catch (InterruptedException e) {
            abandon(opened, abandoned, future);
            Thread.currentThread().interrupt();
            throw new ProviderException(backendId, "Request to " + backendId + " was interrupted", -1, false, e);
        }
    }

    private static void abandon(AtomicReference<EventStream> opened, AtomicBoolean abandoned, Future<?> future) {
        abandoned.set(true);
        EventStream stream = opened.get();
        if (stream != null) {
            stream.close();
        }
        future.cancel(true);
    }
}
