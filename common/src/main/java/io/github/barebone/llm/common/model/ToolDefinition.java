package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool the model may call, described by a JSON schema for its parameters.
 */
public final class ToolDefinition {

    private final String name;
    private final String description;
    private final Map<String, Object> parameters;

    @JsonCreator
    public ToolDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameters") Map<String, Object> parameters) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.description = description != null ? description : "";
        this.parameters = parameters != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) :
                defaultSchema();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * JSON schema of the arguments object
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    private static Map<String, Object> defaultSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Collections.emptyMap());
        return Collections.unmodifiableMap(schema);
    }

    @Override
    public String toString() {
        return "ToolDefinition{name='" + name + "'}";
    }
}
