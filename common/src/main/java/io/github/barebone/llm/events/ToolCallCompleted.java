package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.barebone.llm.common.model.ToolCall;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool call whose arguments have been fully received and parsed.
 */
public final class ToolCallCompleted implements StreamEvent {

    private final String id;
    private final String name;
    private final Map<String, Object> arguments;

    @JsonCreator
    public ToolCallCompleted(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("arguments") Map<String, Object> arguments) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.arguments = arguments != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) :
                Collections.emptyMap();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @JsonIgnore
    public ToolCall toToolCall() {
        return new ToolCall(id, name, arguments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolCallCompleted that = (ToolCallCompleted) o;
        return id.equals(that.id) && name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, arguments);
    }

    @Override
    public String toString() {
        return "ToolCallCompleted{id='" + id + "', name='" + name + "', arguments=" + arguments + '}';
    }
}
