package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool invocation requested by the model.
 */
public final class ToolCall {

    private final String id;
    private final String name;
    private final Map<String, Object> arguments;

    @JsonCreator
    public ToolCall(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("arguments") Map<String, Object> arguments) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.arguments = arguments != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) :
                Collections.emptyMap();
    }

    /**
     * Backend-assigned identifier, echoed back by the matching tool result
     */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolCall toolCall = (ToolCall) o;
        return id.equals(toolCall.id) && name.equals(toolCall.name) && arguments.equals(toolCall.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, arguments);
    }

    @Override
    public String toString() {
        return "ToolCall{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", arguments=" + arguments +
                '}';
    }
}
