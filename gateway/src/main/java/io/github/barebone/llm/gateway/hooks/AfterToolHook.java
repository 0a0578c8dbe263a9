package io.github.barebone.llm.gateway.hooks;

import io.github.barebone.llm.common.model.ToolCall;

/**
 * Runs after a tool call has produced its result.
 */
@FunctionalInterface
public interface AfterToolHook {

    /**
     * @return a replacement result, or null to keep {@code result}
     */
    String apply(ToolCall toolCall, String result) throws Exception;
}
