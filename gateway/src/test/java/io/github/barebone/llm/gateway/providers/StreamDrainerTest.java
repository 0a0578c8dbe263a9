package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.GatewayTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StreamDrainer.
 */
class StreamDrainerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Serves queued events, then blocks until closed if told to stall.
     */
    private static class ScriptedStream implements EventStream {
        private final Deque<StreamEvent> events;
        private final boolean stall;
        private final CountDownLatch closed = new CountDownLatch(1);

        ScriptedStream(boolean stall, StreamEvent... events) {
            this.events = new ArrayDeque<>(Arrays.asList(events));
            this.stall = stall;
        }

        @Override
        public boolean hasNext() throws GatewayException {
            if (events.isEmpty() && stall) {
                try {
                    closed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new ProviderException("test", "closed", -1, false);
            }
            return !events.isEmpty();
        }

        @Override
        public StreamEvent next() {
            return events.poll();
        }

        @Override
        public void close() {
            closed.countDown();
        }

        boolean isClosed() {
            return closed.getCount() == 0;
        }
    }

    @Test
    void testDrainReturnsTurn() throws Exception {
        TurnCompleted turn = TurnCompleted.builder().content("done").stopReason("end_turn").build();
        ScriptedStream stream = new ScriptedStream(false, new TextFragment("done"), turn);

        assertSame(turn, StreamDrainer.drain(stream, "test"));
        assertTrue(stream.isClosed());
    }

    @Test
    void testDrainWithoutTurnFails() {
        ScriptedStream stream = new ScriptedStream(false, new TextFragment("orphan"));

        assertThrows(BackendProtocolException.class, () -> StreamDrainer.drain(stream, "test"));
    }

    @Test
    void testTimedDrainCompletesInTime() throws Exception {
        TurnCompleted turn = TurnCompleted.builder().content("ok").build();

        assertSame(turn, StreamDrainer.drain(new ScriptedStream(false, turn), "test",
                Duration.ofSeconds(5), executor));
    }

    @Test
    void testTimedDrainTimesOutAndCloses() throws Exception {
        ScriptedStream stream = new ScriptedStream(true, new TextFragment("slow"));

        GatewayTimeoutException e = assertThrows(GatewayTimeoutException.class,
                () -> StreamDrainer.drain(stream, "test", Duration.ofMillis(200), executor));

        assertEquals(Duration.ofMillis(200), e.getTimeout());
        assertTrue(stream.isClosed());
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "drain task exits once the stream is closed");
    }

    @Test
    void testTimedDrainCountsSlowOpen() throws Exception {
        ScriptedStream stream = new ScriptedStream(false, TurnCompleted.builder().content("late").build());
        StreamDrainer.StreamOpener slowOpen = () -> {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return stream;
        };

        long started = System.nanoTime();
        assertThrows(GatewayTimeoutException.class,
                () -> StreamDrainer.drain(slowOpen, "test", Duration.ofMillis(200), executor));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 900);
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(stream.isClosed(), "stream opened after the deadline is closed");
    }

    @Test
    void testTimedDrainOpenFailurePropagates() {
        StreamDrainer.StreamOpener failingOpen = () -> {
            throw new ProviderException("test", "Bad request: nope", 400, false);
        };

        ProviderException e = assertThrows(ProviderException.class,
                () -> StreamDrainer.drain(failingOpen, "test", Duration.ofSeconds(5), executor));
        assertEquals(400, e.getStatusCode());
    }

    @Test
    void testTimedDrainPropagatesGatewayErrors() {
        EventStream failing = new ScriptedStream(false) {
            @Override
            public boolean hasNext() throws GatewayException {
                throw new RateLimitedException("test", "slow down", Duration.ofSeconds(3));
            }
        };

        RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> StreamDrainer.drain(failing, "test", Duration.ofSeconds(5), executor));
        assertEquals(Duration.ofSeconds(3), e.getRetryAfter().orElseThrow());
    }
}
