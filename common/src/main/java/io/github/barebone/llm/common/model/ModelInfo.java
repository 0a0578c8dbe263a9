package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A model advertised by a backend's model listing endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ModelInfo {

    private final String id;
    private final String name;
    private final String description;
    private final Integer contextLength;

    public ModelInfo(String id, String name, String description, Integer contextLength) {
        this.id = id;
        this.name = name != null ? name : id;
        this.description = description;
        this.contextLength = contextLength;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Integer getContextLength() {
        return contextLength;
    }

    @Override
    public String toString() {
        return "ModelInfo{id='" + id + "', contextLength=" + contextLength + '}';
    }
}
