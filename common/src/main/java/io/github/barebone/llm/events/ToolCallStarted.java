package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The model began a tool call; arguments follow as fragments.
 */
public final class ToolCallStarted implements StreamEvent {

    private final String id;
    private final String name;

    @JsonCreator
    public ToolCallStarted(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolCallStarted that = (ToolCallStarted) o;
        return id.equals(that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "ToolCallStarted{id='" + id + "', name='" + name + "'}";
    }
}
