package io.github.barebone.llm.gateway.hooks;

import io.github.barebone.llm.common.model.ToolCall;

/**
 * Runs before a tool call and decides whether it may proceed.
 */
@FunctionalInterface
public interface BeforeToolHook {

    HookDecision evaluate(ToolCall toolCall) throws Exception;
}
