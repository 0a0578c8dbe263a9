package io.github.barebone.llm.gateway.hooks;

import io.github.barebone.llm.common.model.ToolCall;

/**
 * Executes a tool call on behalf of the caller. The gateway ships no tools.
 */
@FunctionalInterface
public interface ToolExecutor {

    String execute(ToolCall toolCall) throws Exception;
}
