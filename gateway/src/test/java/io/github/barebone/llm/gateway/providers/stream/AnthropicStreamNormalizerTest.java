package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.ToolCallArgumentFragment;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.ToolCallStarted;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.providers.BackendProtocolException;
import io.github.barebone.llm.gateway.providers.ProviderException;
import io.github.barebone.llm.gateway.providers.RateLimitedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AnthropicStreamNormalizer.
 */
class AnthropicStreamNormalizerTest {

    private NormalizerHarness harness;

    @BeforeEach
    void setUp() {
        harness = new NormalizerHarness(
                new AnthropicStreamNormalizer("anthropic", "claude-sonnet-4-20250514", new ObjectMapper()));
    }

    private void messageStart() throws Exception {
        harness.feed("message_start", "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_1\"," +
                "\"model\":\"claude-sonnet-4-20250514\",\"usage\":{\"input_tokens\":10,\"output_tokens\":1}}}");
    }

    // ========== Text and Tool Use ==========

    @Test
    void testTextThenToolCall() throws Exception {
        messageStart();
        harness.feed("content_block_start",
                        "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}")
                .feed("content_block_delta",
                        "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Let me check\"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":0}")
                .feed("content_block_start", "{\"type\":\"content_block_start\",\"index\":1," +
                        "\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"get_weather\",\"input\":{}}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":1," +
                        "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"loc\"}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":1," +
                        "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"ation\\\": \\\"Tokyo\\\"}\"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":1}")
                .feed("message_delta", "{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"tool_use\"}," +
                        "\"usage\":{\"output_tokens\":25}}")
                .feed("message_stop", "{\"type\":\"message_stop\"}")
                .finish();

        List<StreamEvent> expected = Arrays.asList(
                new TextFragment("Let me check"),
                new ToolCallStarted("toolu_1", "get_weather"),
                new ToolCallArgumentFragment("toolu_1", "{\"loc"),
                new ToolCallArgumentFragment("toolu_1", "ation\": \"Tokyo\"}"),
                new ToolCallCompleted("toolu_1", "get_weather", Collections.singletonMap("location", "Tokyo")));
        assertEquals(expected, harness.events().subList(0, 5));

        TurnCompleted turn = harness.turn();
        assertEquals("Let me check", turn.getContent());
        assertEquals("tool_use", turn.getStopReason());
        assertTrue(turn.isToolUse());
        assertEquals(1, turn.getToolCalls().size());
        assertEquals("Tokyo", turn.getToolCalls().get(0).getArguments().get("location"));
        assertEquals(10, turn.getUsage().getInputTokens());
        assertEquals(25, turn.getUsage().getOutputTokens());
        assertEquals(35, turn.getUsage().getTotalTokens());
        assertEquals("anthropic", turn.getBackendId());
        assertTrue(harness.events().get(harness.events().size() - 1).isTerminal());
    }

    @Test
    void testMalformedArgumentsBecomeEmptyObject() throws Exception {
        messageStart();
        harness.feed("content_block_start", "{\"type\":\"content_block_start\",\"index\":0," +
                        "\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"search\"}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":0," +
                        "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"q\\\": \"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":0}")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        ToolCallCompleted completed = harness.eventsOf(ToolCallCompleted.class).get(0);
        assertTrue(completed.getArguments().isEmpty());
    }

    @Test
    void testTrailingGarbageInArgumentsBecomesEmptyObject() throws Exception {
        messageStart();
        harness.feed("content_block_start", "{\"type\":\"content_block_start\",\"index\":0," +
                        "\"content_block\":{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"get_weather\"}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":0," +
                        "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"city\\\":\"}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":0," +
                        "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"\\\"Tokyo\\\"}}\"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":0}")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        ToolCallCompleted completed = harness.eventsOf(ToolCallCompleted.class).get(0);
        assertEquals("get_weather", completed.getName());
        assertTrue(completed.getArguments().isEmpty());
    }

    @Test
    void testToolCallWithoutArguments() throws Exception {
        messageStart();
        harness.feed("content_block_start", "{\"type\":\"content_block_start\",\"index\":0," +
                        "\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"now\"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":0}")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        assertEquals(Collections.emptyMap(), harness.turn().getToolCalls().get(0).getArguments());
        assertTrue(harness.eventsOf(ToolCallArgumentFragment.class).isEmpty());
    }

    @Test
    void testThinkingBlocksIgnored() throws Exception {
        messageStart();
        harness.feed("content_block_start", "{\"type\":\"content_block_start\",\"index\":0," +
                        "\"content_block\":{\"type\":\"thinking\",\"thinking\":\"\"}}")
                .feed("content_block_delta", "{\"type\":\"content_block_delta\",\"index\":0," +
                        "\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"hmm\"}}")
                .feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":0}")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        assertEquals(1, harness.events().size());
        assertEquals("", harness.turn().getContent());
    }

    // ========== Resilience ==========

    @Test
    void testPingAndUnknownEventsIgnored() throws Exception {
        messageStart();
        harness.feed("ping", "{\"type\":\"ping\"}")
                .feed("brand_new", "{\"type\":\"brand_new\"}")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        assertEquals(1, harness.events().size());
    }

    @Test
    void testUnparseableDataSkipped() throws Exception {
        messageStart();
        harness.feed("content_block_delta", "{not json")
                .feed("message_stop", "{\"type\":\"message_stop\"}");

        assertEquals(1, harness.events().size());
    }

    @Test
    void testEventsAfterStopIgnored() throws Exception {
        messageStart();
        harness.feed("message_stop", "{\"type\":\"message_stop\"}")
                .feed("content_block_start",
                        "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"late\"}}");

        assertEquals(1, harness.events().size());
    }

    @Test
    void testEndOfStreamBeforeStop() throws Exception {
        messageStart();
        harness.feed("content_block_start",
                "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"hi\"}}");

        assertThrows(BackendProtocolException.class, () -> harness.finish());
    }

    // ========== Errors ==========

    @Test
    void testOverloadedErrorIsRetryable() throws Exception {
        messageStart();
        ProviderException e = assertThrows(ProviderException.class, () -> harness.feed("error",
                "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}"));

        assertTrue(e.isRetryable());
        assertTrue(e.getMessage().contains("Overloaded"));
    }

    @Test
    void testRateLimitErrorEvent() {
        assertThrows(RateLimitedException.class, () -> harness.feed("error",
                "{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"slow down\"}}"));
    }

    @Test
    void testInvalidRequestErrorIsFatal() {
        ProviderException e = assertThrows(ProviderException.class, () -> harness.feed("error",
                "{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"bad\"}}"));
        assertFalse(e.isRetryable());
    }

    @Test
    void testDeltaForUnknownBlock() throws Exception {
        messageStart();
        assertThrows(BackendProtocolException.class, () -> harness.feed("content_block_delta",
                "{\"type\":\"content_block_delta\",\"index\":3,\"delta\":{\"type\":\"text_delta\",\"text\":\"x\"}}"));
    }

    @Test
    void testBlockStartedTwice() throws Exception {
        messageStart();
        String start = "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}";
        harness.feed("content_block_start", start);

        assertThrows(BackendProtocolException.class, () -> harness.feed("content_block_start", start));
    }

    @Test
    void testStopForUnknownBlock() throws Exception {
        messageStart();
        assertThrows(BackendProtocolException.class,
                () -> harness.feed("content_block_stop", "{\"type\":\"content_block_stop\",\"index\":9}"));
    }
}
