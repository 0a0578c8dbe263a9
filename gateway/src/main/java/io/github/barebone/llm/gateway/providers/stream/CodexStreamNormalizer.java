package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Normalizes the Responses API stream used by the Codex backend.
 * <p>
 * A function call is announced by {@code response.output_item.added} (call id
 * and name), its arguments stream through
 * {@code response.function_call_arguments.delta} and
 * {@code response.output_item.done} carries the final arguments, which win
 * over the streamed fragments. {@code response.completed} carries usage.
 */
public class CodexStreamNormalizer extends AbstractStreamNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(CodexStreamNormalizer.class);

    private final Map<String, ToolCallAccumulator> calls = new LinkedHashMap<>();

    public CodexStreamNormalizer(String backendId, String model, ObjectMapper objectMapper) {
        super(backendId, model, objectMapper);
    }

    @Override
    protected void handle(String type, JsonNode data, Consumer<StreamEvent> sink) throws GatewayException {
        if (type == null) {
            logger.debug("Ignoring untyped event from {}", backendId);
            return;
        }
        switch (type) {
            case "response.created":
            case "response.in_progress":
                setModel(data.path("response").path("model").asText(null));
                break;
            case "response.output_text.delta":
                emitText(data.path("delta").asText(""), sink);
                break;
            case "response.output_text.done":
                endText();
                break;
            case "response.output_item.added":
                onItemAdded(data.path("item"), data.path("output_index").asInt(calls.size()), sink);
                break;
            case "response.function_call_arguments.delta":
                onArgumentsDelta(data, sink);
                break;
            case "response.function_call_arguments.done":
                ToolCallAccumulator call = calls.get(itemKey(data.path("item_id"), data.path("output_index")));
                if (call != null && data.has("arguments")) {
                    call.setFinalArguments(data.path("arguments").asText());
                }
                break;
            case "response.output_item.done":
                onItemDone(data.path("item"), data.path("output_index").asInt(calls.size()), sink);
                break;
            case "response.completed":
            case "response.done":
            case "response.incomplete":
                onCompleted(data.path("response"), sink);
                break;
            case "response.failed":
                JsonNode failure = data.path("response").path("error");
                throw streamError(failure.path("code").asText(null), failure.path("message").asText(null));
            case "error":
                String code = data.path("code").asText(null);
                String message = data.path("message").asText(null);
                if (code == null && data.has("error")) {
                    code = data.path("error").path("code").asText(data.path("error").path("type").asText(null));
                    message = data.path("error").path("message").asText(message);
                }
                throw streamError(code, message);
            default:
                logger.debug("Ignoring unknown {} event type '{}'", backendId, type);
        }
    }

    private void onItemAdded(JsonNode item, int outputIndex, Consumer<StreamEvent> sink) throws GatewayException {
        if (!"function_call".equals(item.path("type").asText())) {
            return;
        }
        String key = itemKey(item.path("id"), outputIndex);
        if (calls.containsKey(key)) {
            throw protocolError("Function call item " + key + " added twice");
        }
        String callId = item.path("call_id").asText(item.path("id").asText(null));
        String name = item.path("name").asText(null);
        if (callId == null || name == null) {
            throw protocolError("Function call item " + key + " has no call_id or name");
        }
        ToolCallAccumulator call = new ToolCallAccumulator(outputIndex, callId, name);
        calls.put(key, call);
        startToolCall(call, sink);
        appendArguments(call, item.path("arguments").asText(""), sink);
    }

    private void onArgumentsDelta(JsonNode data, Consumer<StreamEvent> sink) throws GatewayException {
        String key = itemKey(data.path("item_id"), data.path("output_index"));
        ToolCallAccumulator call = calls.get(key);
        if (call == null) {
            throw protocolError("Argument delta for unknown function call item " + key);
        }
        appendArguments(call, data.path("delta").asText(""), sink);
    }

    private void onItemDone(JsonNode item, int outputIndex, Consumer<StreamEvent> sink) throws GatewayException {
        String itemType = item.path("type").asText();
        if ("message".equals(itemType)) {
            endText();
            return;
        }
        if (!"function_call".equals(itemType)) {
            return;
        }
        String key = itemKey(item.path("id"), outputIndex);
        ToolCallAccumulator call = calls.get(key);
        if (call == null) {
            // Item was never announced; take everything from the final item
            String callId = item.path("call_id").asText(item.path("id").asText(null));
            String name = item.path("name").asText(null);
            if (callId == null || name == null) {
                throw protocolError("Function call item " + key + " has no call_id or name");
            }
            call = new ToolCallAccumulator(outputIndex, callId, name);
            calls.put(key, call);
            startToolCall(call, sink);
        }
        if (item.has("arguments")) {
            call.setFinalArguments(item.path("arguments").asText());
        }
        completeToolCall(call, sink);
    }

    private void onCompleted(JsonNode response, Consumer<StreamEvent> sink) {
        setModel(response.path("model").asText(null));
        JsonNode usage = response.path("usage");
        if (usage.isObject()) {
            setInputTokens(usage.path("input_tokens").asInt());
            setOutputTokens(usage.path("output_tokens").asInt());
            setTotalTokens(usage.path("total_tokens").asInt());
        }

        for (ToolCallAccumulator call : calls.values()) {
            completeToolCall(call, sink);
        }

        String status = response.path("status").asText("completed");
        if ("incomplete".equals(status)) {
            setStopReason(response.path("incomplete_details").path("reason").asText("incomplete"));
        } else if (!getToolCalls().isEmpty()) {
            setStopReason(GatewayConstants.STOP_TOOL_CALLS);
        } else {
            setStopReason("stop");
        }
        completeTurn(sink);
    }

    @Override
    protected void onDoneMarker(Consumer<StreamEvent> sink) {
        for (ToolCallAccumulator call : calls.values()) {
            completeToolCall(call, sink);
        }
        completeTurn(sink);
    }

    private static String itemKey(JsonNode itemId, JsonNode outputIndex) {
        if (itemId.isTextual() && !itemId.asText().isEmpty()) {
            return itemId.asText();
        }
        return "#" + outputIndex.asInt();
    }

    private static String itemKey(JsonNode itemId, int outputIndex) {
        if (itemId.isTextual() && !itemId.asText().isEmpty()) {
            return itemId.asText();
        }
        return "#" + outputIndex;
    }
}
