package io.github.barebone.llm.gateway.providers.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.Usage;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TextFragment;
import io.github.barebone.llm.events.ToolCallArgumentFragment;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.ToolCallStarted;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.providers.BackendProtocolException;
import io.github.barebone.llm.gateway.providers.ProviderException;
import io.github.barebone.llm.gateway.providers.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Turn state shared by all dialects.
 * <p>
 * The turn moves {@code IDLE -> IN_TEXT | IN_TOOL_USE -> IDLE -> ... -> DONE}.
 * Text is emitted as soon as it arrives. Tool call arguments are collected as
 * raw fragments and parsed only when the call completes; unparseable arguments
 * become an empty object. Exactly one {@link TurnCompleted} is emitted.
 */
public abstract class AbstractStreamNormalizer implements StreamNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractStreamNormalizer.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    /**
     * Parser phase
     */
    public enum Phase {
        IDLE,
        IN_TEXT,
        IN_TOOL_USE,
        DONE
    }

    protected final String backendId;
    protected final ObjectMapper objectMapper;

    private final StringBuilder content = new StringBuilder();
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private Phase phase = Phase.IDLE;
    private String model;
    private String stopReason;
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    protected AbstractStreamNormalizer(String backendId, String model, ObjectMapper objectMapper) {
        this.backendId = backendId;
        this.model = model;
        this.objectMapper = objectMapper;
    }

    @Override
    public final void accept(SseEvent event, Consumer<StreamEvent> sink) throws GatewayException {
        if (phase == Phase.DONE) {
            logger.debug("Ignoring {} event after end of turn", backendId);
            return;
        }
        if (event.isDoneMarker()) {
            onDoneMarker(sink);
            return;
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(event.getData());
        } catch (IOException e) {
            logger.warn("Skipping unparseable {} stream data: {}", backendId, abbreviate(event.getData()));
            return;
        }
        if (data == null || !data.isObject()) {
            logger.warn("Skipping non-object {} stream data: {}", backendId, abbreviate(event.getData()));
            return;
        }

        String type = data.path("type").asText(null);
        if (type == null) {
            type = event.getEvent();
        }
        handle(type, data, sink);
    }

    /**
     * Handles one parsed event.
     *
     * @param type event type from the payload, or the SSE event name; may be null
     */
    protected abstract void handle(String type, JsonNode data, Consumer<StreamEvent> sink) throws GatewayException;

    /**
     * Handles a literal {@code [DONE]}. Ends the turn by default.
     */
    protected void onDoneMarker(Consumer<StreamEvent> sink) throws GatewayException {
        completeTurn(sink);
    }

    @Override
    public void finish(Consumer<StreamEvent> sink) throws GatewayException {
        if (phase != Phase.DONE) {
            throw new BackendProtocolException(backendId, "Stream from " + backendId + " ended before the turn completed");
        }
    }

    @Override
    public boolean isDone() {
        return phase == Phase.DONE;
    }

    public Phase getPhase() {
        return phase;
    }

    // Emission helpers

    protected void emitText(String text, Consumer<StreamEvent> sink) {
        if (text == null || text.isEmpty()) {
            return;
        }
        content.append(text);
        phase = Phase.IN_TEXT;
        sink.accept(new TextFragment(text));
    }

    /**
     * Ends a text block.
     */
    protected void endText() {
        if (phase == Phase.IN_TEXT) {
            phase = Phase.IDLE;
        }
    }

    /**
     * Starts a tool call whose id and name are known, then releases any fragments held for it.
     */
    protected void startToolCall(ToolCallAccumulator call, Consumer<StreamEvent> sink) {
        List<String> held = call.start();
        phase = Phase.IN_TOOL_USE;
        sink.accept(new ToolCallStarted(call.getId(), call.getName()));
        for (String fragment : held) {
            if (!fragment.isEmpty()) {
                sink.accept(new ToolCallArgumentFragment(call.getId(), fragment));
            }
        }
    }

    protected void appendArguments(ToolCallAccumulator call, String fragment, Consumer<StreamEvent> sink) {
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        if (call.append(fragment)) {
            sink.accept(new ToolCallArgumentFragment(call.getId(), fragment));
        }
    }

    /**
     * Parses the call's arguments and emits its completion.
     */
    protected void completeToolCall(ToolCallAccumulator call, Consumer<StreamEvent> sink) {
        if (call.isCompleted()) {
            return;
        }
        Map<String, Object> arguments = parseArguments(call.getArgumentsJson(), call.getName());
        call.markCompleted();
        toolCalls.add(new ToolCall(call.getId(), call.getName(), arguments));
        phase = Phase.IDLE;
        sink.accept(new ToolCallCompleted(call.getId(), call.getName(), arguments));
    }

    /**
     * Emits the single terminal event. Later calls do nothing.
     */
    protected void completeTurn(Consumer<StreamEvent> sink) {
        if (phase == Phase.DONE) {
            return;
        }
        phase = Phase.DONE;
        sink.accept(TurnCompleted.builder()
                .content(content.toString())
                .toolCalls(toolCalls)
                .stopReason(stopReason)
                .usage(Usage.of(inputTokens, outputTokens, totalTokens))
                .model(model)
                .backendId(backendId)
                .build());
    }

    /**
     * Parses complete tool arguments. Empty or invalid JSON yields an empty map.
     */
    protected Map<String, Object> parseArguments(String json, String toolName) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            JsonNode node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(json);
            if (node == null || !node.isObject()) {
                logger.warn("Arguments for tool '{}' from {} are not a JSON object, using empty arguments",
                        toolName, backendId);
                return Collections.emptyMap();
            }
            return objectMapper.convertValue(node, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Malformed arguments for tool '{}' from {}, using empty arguments: {}",
                    toolName, backendId, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    // State accessors for subclasses

    protected List<ToolCall> getToolCalls() {
        return Collections.unmodifiableList(toolCalls);
    }

    protected String getStopReason() {
        return stopReason;
    }

    protected void setStopReason(String stopReason) {
        this.stopReason = stopReason;
    }

    protected void setModel(String model) {
        if (model != null && !model.isEmpty()) {
            this.model = model;
        }
    }

    protected void setInputTokens(int inputTokens) {
        this.inputTokens = inputTokens;
    }

    protected void setOutputTokens(int outputTokens) {
        this.outputTokens = outputTokens;
    }

    protected void setTotalTokens(int totalTokens) {
        this.totalTokens = totalTokens;
    }

    // Errors

    protected BackendProtocolException protocolError(String message) {
        return new BackendProtocolException(backendId, message);
    }

    /**
     * Maps an error payload sent inside the stream to a typed exception.
     */
    protected ProviderException streamError(String errorType, String message) {
        String text = backendId + " stream error" + (errorType != null ? " (" + errorType + ")" : "") +
                ": " + (message != null ? message : "unknown error");
        if (errorType != null && (errorType.contains("rate_limit") || errorType.contains("usage_limit"))) {
            return new RateLimitedException(backendId, text, null);
        }
        boolean retryable = errorType != null &&
                (errorType.contains("overloaded") || errorType.contains("server_error") || errorType.contains("api_error"));
        return new ProviderException(backendId, text, -1, retryable);
    }

    private static String abbreviate(String data) {
        return data.length() > 120 ? data.substring(0, 120) + "..." : data;
    }
}
