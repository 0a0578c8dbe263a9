package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base interface for the unified events produced while a backend streams a turn.
 * <p>
 * Every stream is a sequence of fragment and tool call events ending with
 * exactly one {@link TurnCompleted}.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextFragment.class, name = "text"),
        @JsonSubTypes.Type(value = ToolCallStarted.class, name = "tool_call_started"),
        @JsonSubTypes.Type(value = ToolCallArgumentFragment.class, name = "tool_call_argument"),
        @JsonSubTypes.Type(value = ToolCallCompleted.class, name = "tool_call_completed"),
        @JsonSubTypes.Type(value = TurnCompleted.class, name = "turn_completed")
})
public interface StreamEvent {

    /**
     * Returns whether this event ends the stream.
     */
    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }
}
