package io.github.barebone.llm.gateway.providers;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.ToolCallStarted;
import io.github.barebone.llm.events.TurnCompleted;

/**
 * Callback interface for streaming responses.
 */
public interface StreamingCallback {

    /**
     * Called when a piece of text is received
     */
    void onToken(String token);

    /**
     * Called when the model starts a tool call
     */
    default void onToolCallStarted(ToolCallStarted event) {
    }

    /**
     * Called when a tool call's arguments are complete
     */
    void onToolCall(ToolCallCompleted toolCall);

    /**
     * Called when the stream is complete
     */
    void onComplete(TurnCompleted turn);

    /**
     * Called when an error occurs during streaming
     */
    void onError(GatewayException error);
}
