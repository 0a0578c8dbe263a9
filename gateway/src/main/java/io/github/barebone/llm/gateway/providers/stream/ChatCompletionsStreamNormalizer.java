package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Normalizes an OpenAI-compatible Chat Completions stream.
 * <p>
 * Chunks carry {@code choices[0].delta}. Tool calls are keyed by their numeric
 * {@code index} and may interleave; id and name can show up after the first
 * argument fragments. Calls are completed in index order once a
 * {@code finish_reason} or {@code [DONE]} arrives. Usage comes in a trailing
 * chunk without choices.
 */
public class ChatCompletionsStreamNormalizer extends AbstractStreamNormalizer {

    private final Map<Integer, ToolCallAccumulator> calls = new TreeMap<>();
    private boolean finished;

    public ChatCompletionsStreamNormalizer(String backendId, String model, ObjectMapper objectMapper) {
        super(backendId, model, objectMapper);
    }

    @Override
    protected void handle(String type, JsonNode data, Consumer<StreamEvent> sink) throws GatewayException {
        if (data.has("error")) {
            JsonNode error = data.path("error");
            String errorType = error.path("type").asText(null);
            if (errorType == null && error.path("code").asInt() == 429) {
                errorType = "rate_limit";
            }
            throw streamError(errorType, error.path("message").asText(null));
        }

        setModel(data.path("model").asText(null));

        JsonNode choices = data.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode delta = choice.path("delta");

            emitText(delta.path("content").asText(""), sink);

            JsonNode toolCalls = delta.path("tool_calls");
            if (toolCalls.isArray()) {
                int position = 0;
                for (JsonNode toolCall : toolCalls) {
                    onToolCallDelta(toolCall.path("index").asInt(position), toolCall, sink);
                    position++;
                }
            }

            String finishReason = choice.path("finish_reason").asText(null);
            if (finishReason != null && !"null".equals(finishReason)) {
                setStopReason(finishReason);
                completeToolCalls(sink);
            }
        }

        JsonNode usage = data.get("usage");
        if (usage != null && usage.isObject()) {
            setInputTokens(usage.path("prompt_tokens").asInt());
            setOutputTokens(usage.path("completion_tokens").asInt());
            setTotalTokens(usage.path("total_tokens").asInt());
        }
    }

    private void onToolCallDelta(int index, JsonNode toolCall, Consumer<StreamEvent> sink) throws GatewayException {
        if (finished && !calls.containsKey(index)) {
            throw protocolError("New tool call " + index + " after the finish reason");
        }
        ToolCallAccumulator call = calls.computeIfAbsent(index, ToolCallAccumulator::new);
        if (call.isCompleted()) {
            throw protocolError("Delta for tool call " + index + " after it completed");
        }
        String id = toolCall.path("id").asText(null);
        if (id != null && !id.isEmpty() && call.getId() == null) {
            call.setId(id);
        }
        JsonNode function = toolCall.path("function");
        String name = function.path("name").asText(null);
        if (name != null && !name.isEmpty() && call.getName() == null) {
            call.setName(name);
        }

        if (!call.isStarted() && call.canStart()) {
            startToolCall(call, sink);
        }
        appendArguments(call, function.path("arguments").asText(""), sink);
    }

    private void completeToolCalls(Consumer<StreamEvent> sink) throws GatewayException {
        if (finished) {
            return;
        }
        finished = true;
        for (ToolCallAccumulator call : calls.values()) {
            if (!call.isStarted()) {
                if (call.getName() == null) {
                    throw protocolError("Tool call " + call.getIndex() + " never received a name");
                }
                if (call.getId() == null) {
                    call.setId("call_" + call.getIndex());
                }
                startToolCall(call, sink);
            }
            completeToolCall(call, sink);
        }
        endText();
    }

    @Override
    protected void onDoneMarker(Consumer<StreamEvent> sink) throws GatewayException {
        completeToolCalls(sink);
        completeTurn(sink);
    }

    /**
     * Some compatible servers close the body after the finish reason without sending {@code [DONE]}.
     */
    @Override
    public void finish(Consumer<StreamEvent> sink) throws GatewayException {
        if (!isDone() && finished) {
            completeTurn(sink);
        }
        super.finish(sink);
    }
}
