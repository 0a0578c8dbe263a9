package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single message in a conversation.
 * <p>
 * Content is either plain text or a list of structured blocks (text and
 * images). Assistant messages may carry tool calls; tool result messages
 * reference the call they answer through {@link #getToolCallId()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Message {

    /**
     * Role of the message sender
     */
    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT,
        TOOL_RESULT
    }

    private final Role role;
    private final String content;
    private final List<ContentBlock> blocks;
    private final List<ToolCall> toolCalls;
    private final String toolCallId;
    private final String name;
    private final boolean error;

    private Message(Builder builder) {
        this.role = Objects.requireNonNull(builder.role, "role cannot be null");
        this.content = builder.content;
        this.blocks = builder.blocks != null ?
                Collections.unmodifiableList(builder.blocks) : Collections.emptyList();
        this.toolCalls = builder.toolCalls != null ?
                Collections.unmodifiableList(builder.toolCalls) : Collections.emptyList();
        this.toolCallId = builder.toolCallId;
        this.name = builder.name;
        this.error = builder.error;

        if (role == Role.TOOL_RESULT && toolCallId == null) {
            throw new IllegalArgumentException("Tool result messages require a toolCallId");
        }
    }

    public Role getRole() {
        return role;
    }

    /**
     * Plain text content, null when the message only has blocks or tool calls
     */
    public String getContent() {
        return content;
    }

    public List<ContentBlock> getBlocks() {
        return blocks;
    }

    /**
     * Tool calls made by the assistant (only for ASSISTANT messages)
     */
    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    /**
     * ID of the tool call this message answers (only for TOOL_RESULT messages)
     */
    public String getToolCallId() {
        return toolCallId;
    }

    /**
     * Tool name (only for TOOL_RESULT messages)
     */
    public String getName() {
        return name;
    }

    public boolean isError() {
        return error;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasBlocks() {
        return !blocks.isEmpty();
    }

    /**
     * Returns all text of this message: the plain content, or the text blocks joined.
     */
    @JsonIgnore
    public String getText() {
        if (content != null) {
            return content;
        }
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : blocks) {
            if (block.getType() == ContentBlock.Type.TEXT && block.getText() != null) {
                text.append(block.getText());
            }
        }
        return text.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Message user(String content) {
        return builder()
                .role(Role.USER)
                .content(content)
                .build();
    }

    /**
     * Factory for user messages with structured content (e.g. text plus images)
     */
    public static Message user(List<ContentBlock> blocks) {
        return builder()
                .role(Role.USER)
                .blocks(blocks)
                .build();
    }

    public static Message assistant(String content) {
        return builder()
                .role(Role.ASSISTANT)
                .content(content)
                .build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return builder()
                .role(Role.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls)
                .build();
    }

    public static Message system(String content) {
        return builder()
                .role(Role.SYSTEM)
                .content(content)
                .build();
    }

    public static Message toolResult(String toolCallId, String name, String content) {
        return toolResult(toolCallId, name, content, false);
    }

    public static Message toolResult(String toolCallId, String name, String content, boolean error) {
        return builder()
                .role(Role.TOOL_RESULT)
                .toolCallId(toolCallId)
                .name(name)
                .content(content)
                .error(error)
                .build();
    }

    @Override
    public String toString() {
        String text = getText();
        return "Message{" +
                "role=" + role +
                ", content='" + (text.length() > 50 ? text.substring(0, 50) + "..." : text) + '\'' +
                ", toolCalls=" + toolCalls.size() +
                (toolCallId != null ? ", toolCallId='" + toolCallId + '\'' : "") +
                '}';
    }

    public static class Builder {
        private Role role;
        private String content;
        private List<ContentBlock> blocks;
        private List<ToolCall> toolCalls;
        private String toolCallId;
        private String name;
        private boolean error;

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder blocks(List<ContentBlock> blocks) {
            this.blocks = blocks;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public Builder toolCallId(String toolCallId) {
            this.toolCallId = toolCallId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder error(boolean error) {
            this.error = error;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
