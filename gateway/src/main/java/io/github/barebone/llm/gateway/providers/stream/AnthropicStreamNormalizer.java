package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Normalizes the Anthropic Messages stream.
 * <p>
 * Content blocks are addressed by {@code index}: {@code content_block_start},
 * {@code content_block_delta} and {@code content_block_stop}. Usage is split
 * between {@code message_start} (input) and {@code message_delta} (output).
 * {@code message_stop} ends the turn; there is no {@code [DONE]} marker.
 */
public class AnthropicStreamNormalizer extends AbstractStreamNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicStreamNormalizer.class);

    private enum BlockKind {
        TEXT,
        TOOL_USE,
        OTHER
    }

    private final Map<Integer, BlockKind> openBlocks = new HashMap<>();
    private final Map<Integer, ToolCallAccumulator> toolBlocks = new HashMap<>();

    public AnthropicStreamNormalizer(String backendId, String model, ObjectMapper objectMapper) {
        super(backendId, model, objectMapper);
    }

    @Override
    protected void handle(String type, JsonNode data, Consumer<StreamEvent> sink) throws GatewayException {
        if (type == null) {
            logger.debug("Ignoring untyped event from {}", backendId);
            return;
        }
        switch (type) {
            case "message_start":
                onMessageStart(data.path("message"));
                break;
            case "content_block_start":
                onBlockStart(data.path("index").asInt(), data.path("content_block"), sink);
                break;
            case "content_block_delta":
                onBlockDelta(data.path("index").asInt(), data.path("delta"), sink);
                break;
            case "content_block_stop":
                onBlockStop(data.path("index").asInt(), sink);
                break;
            case "message_delta":
                onMessageDelta(data);
                break;
            case "message_stop":
                completeTurn(sink);
                break;
            case "error":
                JsonNode error = data.path("error");
                throw streamError(error.path("type").asText(null), error.path("message").asText(null));
            case "ping":
                break;
            default:
                logger.debug("Ignoring unknown {} event type '{}'", backendId, type);
        }
    }

    private void onMessageStart(JsonNode message) {
        setModel(message.path("model").asText(null));
        JsonNode usage = message.path("usage");
        setInputTokens(usage.path("input_tokens").asInt());
        setOutputTokens(usage.path("output_tokens").asInt());
    }

    private void onBlockStart(int index, JsonNode block, Consumer<StreamEvent> sink) throws GatewayException {
        if (openBlocks.containsKey(index)) {
            throw protocolError("Content block " + index + " started twice");
        }
        String blockType = block.path("type").asText();
        if ("text".equals(blockType)) {
            openBlocks.put(index, BlockKind.TEXT);
            emitText(block.path("text").asText(""), sink);
        } else if ("tool_use".equals(blockType)) {
            String id = block.path("id").asText(null);
            String name = block.path("name").asText(null);
            if (id == null || name == null) {
                throw protocolError("tool_use block " + index + " has no id or name");
            }
            ToolCallAccumulator call = new ToolCallAccumulator(index, id, name);
            openBlocks.put(index, BlockKind.TOOL_USE);
            toolBlocks.put(index, call);
            startToolCall(call, sink);
        } else {
            // thinking, redacted_thinking, server tool blocks
            openBlocks.put(index, BlockKind.OTHER);
        }
    }

    private void onBlockDelta(int index, JsonNode delta, Consumer<StreamEvent> sink) throws GatewayException {
        BlockKind kind = openBlocks.get(index);
        if (kind == null) {
            throw protocolError("Delta for content block " + index + " that was never started");
        }
        String deltaType = delta.path("type").asText();
        if ("text_delta".equals(deltaType)) {
            emitText(delta.path("text").asText(""), sink);
        } else if ("input_json_delta".equals(deltaType)) {
            ToolCallAccumulator call = toolBlocks.get(index);
            if (call == null) {
                throw protocolError("Argument delta for non tool_use block " + index);
            }
            appendArguments(call, delta.path("partial_json").asText(""), sink);
        } else {
            logger.debug("Ignoring {} delta type '{}'", backendId, deltaType);
        }
    }

    private void onBlockStop(int index, Consumer<StreamEvent> sink) throws GatewayException {
        BlockKind kind = openBlocks.remove(index);
        if (kind == null) {
            throw protocolError("Stop for content block " + index + " that was never started");
        }
        if (kind == BlockKind.TOOL_USE) {
            completeToolCall(toolBlocks.remove(index), sink);
        } else if (kind == BlockKind.TEXT) {
            endText();
        }
    }

    private void onMessageDelta(JsonNode data) {
        String stopReason = data.path("delta").path("stop_reason").asText(null);
        if (stopReason != null) {
            setStopReason(stopReason);
        }
        JsonNode usage = data.path("usage");
        if (usage.has("output_tokens")) {
            setOutputTokens(usage.path("output_tokens").asInt());
        }
        if (usage.has("input_tokens") && usage.path("input_tokens").asInt() > 0) {
            setInputTokens(usage.path("input_tokens").asInt());
        }
    }
}
