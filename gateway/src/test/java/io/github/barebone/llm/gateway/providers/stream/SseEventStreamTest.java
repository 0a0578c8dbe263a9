package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.providers.BackendProtocolException;
import io.github.barebone.llm.gateway.providers.ProviderException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SseEventStream.
 */
class SseEventStreamTest {

    private static final String TEXT_TURN =
            "data: {\"choices\":[{\"delta\":{\"content\":\"hi\"},\"finish_reason\":null}]}\n\n" +
            "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n" +
            "data: [DONE]\n\n";

    private static final class TrackingInputStream extends ByteArrayInputStream {
        private boolean closed;

        TrackingInputStream(String body) {
            super(body.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    private static SseEventStream stream(InputStream body) {
        return new SseEventStream("openrouter", body,
                new ChatCompletionsStreamNormalizer("openrouter", "m", new ObjectMapper()));
    }

    @Test
    void testEventsInOrderEndingWithTurn() throws Exception {
        TrackingInputStream body = new TrackingInputStream(TEXT_TURN);
        List<StreamEvent> events = new ArrayList<>();

        try (SseEventStream stream = stream(body)) {
            while (stream.hasNext()) {
                events.add(stream.next());
            }
        }

        assertEquals(2, events.size());
        assertEquals(new TextFragment("hi"), events.get(0));
        assertTrue(events.get(1) instanceof TurnCompleted);
        assertTrue(body.closed, "body is closed once the turn completes");
    }

    @Test
    void testNextAfterEndThrows() throws Exception {
        SseEventStream stream = stream(new TrackingInputStream(TEXT_TURN));
        while (stream.hasNext()) {
            stream.next();
        }

        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
    }

    @Test
    void testBodyEndingBeforeTerminalEvent() throws Exception {
        TrackingInputStream body = new TrackingInputStream(
                "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"},\"finish_reason\":null}]}\n\n");
        SseEventStream stream = stream(body);

        assertTrue(stream.hasNext());
        assertEquals(new TextFragment("partial"), stream.next());
        assertThrows(BackendProtocolException.class, stream::hasNext);
        assertTrue(body.closed);
    }

    @Test
    void testReadFailureIsRetryable() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };

        ProviderException e = assertThrows(ProviderException.class, () -> stream(failing).hasNext());
        assertTrue(e.isRetryable());
    }

    @Test
    void testClosedStreamRefusesReads() {
        SseEventStream stream = stream(new TrackingInputStream(TEXT_TURN));
        stream.close();
        stream.close();

        assertThrows(ProviderException.class, stream::hasNext);
    }
}
