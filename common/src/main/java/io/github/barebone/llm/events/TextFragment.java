package io.github.barebone.llm.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A piece of assistant text, delivered as soon as the backend sends it.
 */
public final class TextFragment implements StreamEvent {

    private final String text;

    @JsonCreator
    public TextFragment(@JsonProperty("text") String text) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((TextFragment) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "TextFragment{'" + text + "'}";
    }
}
