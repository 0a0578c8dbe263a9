package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.Usage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The final event of every stream, and the result of a non-streaming completion.
 * Holds the accumulated text, all completed tool calls, the stop reason and usage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TurnCompleted implements StreamEvent {

    private final String content;
    private final List<ToolCall> toolCalls;
    private final String stopReason;
    private final Usage usage;
    private final String model;
    private final String backendId;

    private TurnCompleted(Builder builder) {
        this.content = builder.content != null ? builder.content : "";
        this.toolCalls = builder.toolCalls != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.toolCalls)) : Collections.emptyList();
        this.stopReason = builder.stopReason;
        this.usage = builder.usage != null ? builder.usage : Usage.empty();
        this.model = builder.model;
        this.backendId = builder.backendId;
    }

    @JsonCreator
    static TurnCompleted fromJson(
            @JsonProperty("content") String content,
            @JsonProperty("toolCalls") List<ToolCall> toolCalls,
            @JsonProperty("stopReason") String stopReason,
            @JsonProperty("usage") Usage usage,
            @JsonProperty("model") String model,
            @JsonProperty("backendId") String backendId) {
        return builder()
                .content(content)
                .toolCalls(toolCalls)
                .stopReason(stopReason)
                .usage(usage)
                .model(model)
                .backendId(backendId)
                .build();
    }

    /**
     * Full assistant text of the turn
     */
    public String getContent() {
        return content;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    /**
     * Reason the generation stopped, as reported by the backend (e.g. "end_turn", "tool_use", "stop")
     */
    public String getStopReason() {
        return stopReason;
    }

    public Usage getUsage() {
        return usage;
    }

    public String getModel() {
        return model;
    }

    public String getBackendId() {
        return backendId;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /**
     * Whether the turn ended because the model wants tool results.
     */
    @JsonIgnore
    public boolean isToolUse() {
        return hasToolCalls() ||
                GatewayConstants.STOP_TOOL_USE.equals(stopReason) ||
                GatewayConstants.STOP_TOOL_CALLS.equals(stopReason);
    }

    @Override
    @JsonIgnore
    public boolean isTerminal() {
        return true;
    }

    /**
     * Converts this turn into the assistant message to append to the conversation.
     */
    public Message toMessage() {
        return Message.assistant(content.isEmpty() ? null : content, toolCalls);
    }

    @Override
    public String toString() {
        return "TurnCompleted{" +
                "backend='" + backendId + '\'' +
                ", model='" + model + '\'' +
                ", content='" + (content.length() > 50 ? content.substring(0, 50) + "..." : content) + '\'' +
                ", toolCalls=" + toolCalls.size() +
                ", stopReason='" + stopReason + '\'' +
                ", usage=" + usage +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String content;
        private List<ToolCall> toolCalls;
        private String stopReason;
        private Usage usage;
        private String model;
        private String backendId;

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public Builder stopReason(String stopReason) {
            this.stopReason = stopReason;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public TurnCompleted build() {
            return new TurnCompleted(this);
        }
    }
}
