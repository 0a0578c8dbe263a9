package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.ToolCallArgumentFragment;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.ToolCallStarted;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.providers.BackendProtocolException;
import io.github.barebone.llm.gateway.providers.RateLimitedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChatCompletionsStreamNormalizer.
 */
class ChatCompletionsStreamNormalizerTest {

    private NormalizerHarness harness;

    @BeforeEach
    void setUp() {
        harness = new NormalizerHarness(
                new ChatCompletionsStreamNormalizer("openrouter", "anthropic/claude-sonnet-4", new ObjectMapper()));
    }

    private static String delta(String deltaJson) {
        return "{\"model\":\"anthropic/claude-sonnet-4\",\"choices\":[{\"index\":0,\"delta\":" + deltaJson +
                ",\"finish_reason\":null}]}";
    }

    private static String finish(String reason) {
        return "{\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"" + reason + "\"}]}";
    }

    // ========== Text ==========

    @Test
    void testTextWithUsageChunk() throws Exception {
        harness.feed(delta("{\"role\":\"assistant\",\"content\":\"Hel\"}"))
                .feed(delta("{\"content\":\"lo\"}"))
                .feed(finish("stop"))
                .feed("{\"choices\":[],\"usage\":{\"prompt_tokens\":7,\"completion_tokens\":2,\"total_tokens\":9}}")
                .feed("[DONE]")
                .finish();

        assertEquals(new TextFragment("Hel"), harness.events().get(0));
        assertEquals(new TextFragment("lo"), harness.events().get(1));
        TurnCompleted turn = harness.turn();
        assertEquals("Hello", turn.getContent());
        assertEquals("stop", turn.getStopReason());
        assertEquals(7, turn.getUsage().getInputTokens());
        assertEquals(9, turn.getUsage().getTotalTokens());
        assertFalse(turn.isToolUse());
    }

    @Test
    void testEndOfBodyAfterFinishReasonCompletes() throws Exception {
        harness.feed(delta("{\"content\":\"ok\"}"))
                .feed(finish("stop"))
                .finish();

        assertEquals("ok", harness.turn().getContent());
    }

    @Test
    void testEndOfBodyWithoutFinishReasonFails() throws Exception {
        harness.feed(delta("{\"content\":\"cut\"}"));

        assertThrows(BackendProtocolException.class, () -> harness.finish());
    }

    // ========== Tool Calls ==========

    @Test
    void testInterleavedToolCalls() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":0,\"id\":\"call_a\",\"type\":\"function\"," +
                        "\"function\":{\"name\":\"get_weather\",\"arguments\":\"\"}}]}"))
                .feed(delta("{\"tool_calls\":[{\"index\":1,\"id\":\"call_b\",\"type\":\"function\"," +
                        "\"function\":{\"name\":\"get_time\",\"arguments\":\"{\\\"tz\\\":\"}}]}"))
                .feed(delta("{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"city\\\":\\\"Paris\\\"}\"}}]}"))
                .feed(delta("{\"tool_calls\":[{\"index\":1,\"function\":{\"arguments\":\"\\\"CET\\\"}\"}}]}"))
                .feed(finish("tool_calls"))
                .feed("[DONE]");

        List<ToolCallCompleted> completed = harness.eventsOf(ToolCallCompleted.class);
        assertEquals(2, completed.size());
        assertEquals("call_a", completed.get(0).getId());
        assertEquals("Paris", completed.get(0).getArguments().get("city"));
        assertEquals("call_b", completed.get(1).getId());
        assertEquals("CET", completed.get(1).getArguments().get("tz"));

        TurnCompleted turn = harness.turn();
        assertEquals("tool_calls", turn.getStopReason());
        assertTrue(turn.isToolUse());
        assertEquals(2, turn.getToolCalls().size());
    }

    @Test
    void testLateIdAndNameReleaseHeldFragments() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"q\\\":\"}}]}"))
                .feed(delta("{\"tool_calls\":[{\"index\":0,\"id\":\"call_late\",\"function\":{\"name\":\"search\"," +
                        "\"arguments\":\"\\\"java\\\"}\"}}]}"))
                .feed(finish("tool_calls"))
                .feed("[DONE]");

        List<StreamEvent> events = harness.events();
        assertEquals(new ToolCallStarted("call_late", "search"), events.get(0));
        assertEquals(new ToolCallArgumentFragment("call_late", "{\"q\":"), events.get(1));
        assertEquals(new ToolCallArgumentFragment("call_late", "\"java\"}"), events.get(2));
        assertEquals("java", harness.eventsOf(ToolCallCompleted.class).get(0).getArguments().get("q"));
    }

    @Test
    void testMissingIdIsSynthesized() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":2,\"function\":{\"name\":\"lookup\",\"arguments\":\"{}\"}}]}"))
                .feed(finish("tool_calls"))
                .feed("[DONE]");

        assertEquals("call_2", harness.eventsOf(ToolCallCompleted.class).get(0).getId());
    }

    @Test
    void testMissingNameIsProtocolError() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":0,\"id\":\"call_x\",\"function\":{\"arguments\":\"{}\"}}]}"));

        assertThrows(BackendProtocolException.class, () -> harness.feed(finish("tool_calls")));
    }

    @Test
    void testDeltaAfterCompletionIsProtocolError() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":0,\"id\":\"call_x\",\"function\":{\"name\":\"f\",\"arguments\":\"{}\"}}]}"))
                .feed(finish("tool_calls"));

        assertThrows(BackendProtocolException.class, () -> harness.feed(
                delta("{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"x\"}}]}")));
    }

    @Test
    void testNewToolCallAfterFinishIsProtocolError() throws Exception {
        harness.feed(delta("{\"tool_calls\":[{\"index\":0,\"id\":\"call_x\",\"function\":{\"name\":\"f\",\"arguments\":\"{}\"}}]}"))
                .feed(finish("tool_calls"));

        assertThrows(BackendProtocolException.class, () -> harness.feed(
                delta("{\"tool_calls\":[{\"index\":1,\"id\":\"call_y\",\"function\":{\"name\":\"g\",\"arguments\":\"{}\"}}]}")));
        assertEquals(1, harness.eventsOf(ToolCallStarted.class).size());
        assertEquals(1, harness.eventsOf(ToolCallCompleted.class).size());
    }

    // ========== Errors ==========

    @Test
    void testErrorChunkWithRateLimitCode() {
        assertThrows(RateLimitedException.class, () -> harness.feed(
                "{\"error\":{\"code\":429,\"message\":\"Rate limit exceeded\"}}"));
    }

    @Test
    void testCommentOnlyDataSkipped() throws Exception {
        harness.feed("not-json")
                .feed(delta("{\"content\":\"fine\"}"))
                .feed(finish("stop"))
                .feed("[DONE]");

        assertEquals("fine", harness.turn().getContent());
    }
}
