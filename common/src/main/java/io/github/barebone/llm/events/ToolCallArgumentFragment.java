package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A raw, unparsed slice of a tool call's JSON arguments.
 */
public final class ToolCallArgumentFragment implements StreamEvent {

    private final String id;
    private final String fragment;

    @JsonCreator
    public ToolCallArgumentFragment(
            @JsonProperty("id") String id,
            @JsonProperty("fragment") String fragment) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.fragment = fragment != null ? fragment : "";
    }

    public String getId() {
        return id;
    }

    public String getFragment() {
        return fragment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolCallArgumentFragment that = (ToolCallArgumentFragment) o;
        return id.equals(that.id) && fragment.equals(that.fragment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fragment);
    }

    @Override
    public String toString() {
        return "ToolCallArgumentFragment{id='" + id + "', fragment='" + fragment + "'}";
    }
}
