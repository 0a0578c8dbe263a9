package io.github.barebone.llm.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.Usage;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the unified stream events.
 */
class StreamEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testOnlyTurnCompletedIsTerminal() {
        assertFalse(new TextFragment("x").isTerminal());
        assertFalse(new ToolCallStarted("id", "name").isTerminal());
        assertFalse(new ToolCallArgumentFragment("id", "{").isTerminal());
        assertFalse(new ToolCallCompleted("id", "name", null).isTerminal());
        assertTrue(TurnCompleted.builder().build().isTerminal());
    }

    @Test
    void testSerialization_carriesTypeDiscriminator() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(new TextFragment("Hi")));

        assertEquals("text", json.get("type").asText());
        assertEquals("Hi", json.get("text").asText());
        assertFalse(json.has("terminal"));
    }

    @Test
    void testDeserialization_turnCompleted() throws Exception {
        String json = "{\"type\":\"turn_completed\",\"content\":\"done\",\"stopReason\":\"end_turn\"," +
                "\"usage\":{\"inputTokens\":3,\"outputTokens\":4,\"totalTokens\":7}," +
                "\"toolCalls\":[{\"id\":\"c1\",\"name\":\"get_weather\",\"arguments\":{\"city\":\"Tokyo\"}}]}";

        StreamEvent event = objectMapper.readValue(json, StreamEvent.class);

        assertInstanceOf(TurnCompleted.class, event);
        TurnCompleted turn = (TurnCompleted) event;
        assertEquals("done", turn.getContent());
        assertEquals(7, turn.getUsage().getTotalTokens());
        assertEquals("Tokyo", turn.getToolCalls().get(0).getArguments().get("city"));
    }

    @Test
    void testTurnCompleted_defaults() {
        TurnCompleted turn = TurnCompleted.builder().build();

        assertEquals("", turn.getContent());
        assertTrue(turn.getToolCalls().isEmpty());
        assertEquals(Usage.empty(), turn.getUsage());
        assertFalse(turn.isToolUse());
    }

    @Test
    void testTurnCompleted_toMessage() {
        ToolCall call = new ToolCall("c1", "get_weather", Map.of("city", "Tokyo"));
        TurnCompleted turn = TurnCompleted.builder()
                .content("")
                .toolCalls(Collections.singletonList(call))
                .stopReason("tool_use")
                .build();

        Message message = turn.toMessage();

        assertEquals(Message.Role.ASSISTANT, message.getRole());
        assertNull(message.getContent());
        assertEquals(call, message.getToolCalls().get(0));
        assertTrue(turn.isToolUse());
    }

    @Test
    void testToolCallCompleted_toToolCall() {
        ToolCallCompleted completed = new ToolCallCompleted("c1", "get_weather", Map.of("city", "Tokyo"));
        assertEquals(new ToolCall("c1", "get_weather", Map.of("city", "Tokyo")), completed.toToolCall());
    }
}
