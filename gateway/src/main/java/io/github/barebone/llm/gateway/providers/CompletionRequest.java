package io.github.barebone.llm.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to send to a backend: one conversation turn.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompletionRequest {

    private final String model;
    private final List<Message> messages;
    private final List<ToolDefinition> tools;
    private final String systemPrompt;
    private final Double temperature;
    private final Integer maxTokens;

    private CompletionRequest(Builder builder) {
        this.model = builder.model;
        this.messages = builder.messages != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.messages)) : Collections.emptyList();
        this.tools = builder.tools != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.tools)) : Collections.emptyList();
        this.systemPrompt = builder.systemPrompt;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
    }

    /**
     * Model id; gateway-level ids may carry a routing prefix, adapter-level ids never do
     */
    public String getModel() {
        return model;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    /**
     * Temperature for response generation
     */
    public Double getTemperature() {
        return temperature;
    }

    /**
     * Maximum tokens in the response; adapters fall back to their configured default
     */
    public Integer getMaxTokens() {
        return maxTokens;
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isEmpty();
    }

    /**
     * Copy of this request addressed to another model id.
     */
    public CompletionRequest withModel(String newModel) {
        return toBuilder().model(newModel).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .model(model)
                .messages(messages)
                .tools(tools)
                .systemPrompt(systemPrompt)
                .temperature(temperature)
                .maxTokens(maxTokens);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CompletionRequest{" +
                "model='" + model + '\'' +
                ", messages=" + messages.size() +
                ", tools=" + tools.size() +
                '}';
    }

    public static class Builder {
        private String model;
        private List<Message> messages;
        private List<ToolDefinition> tools;
        private String systemPrompt;
        private Double temperature;
        private Integer maxTokens;

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder addMessage(Message message) {
            if (this.messages == null) {
                this.messages = new ArrayList<>();
            }
            this.messages.add(message);
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            this.tools = tools;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public CompletionRequest build() {
            return new CompletionRequest(this);
        }
    }
}
