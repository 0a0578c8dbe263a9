package io.github.barebone.llm.gateway.hooks;

import io.github.barebone.llm.common.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Before and after hooks around tool execution.
 * <p>
 * Before-hooks run in registration order and the first denial stops the chain;
 * the executor is then never called. After-hooks run in order and each may
 * replace the result. Exceptions from hooks or from the executor produce an
 * {@link HookOutcome.Status#ERROR} outcome instead of propagating.
 */
public class ToolCallHooks {

    private static final Logger logger = LoggerFactory.getLogger(ToolCallHooks.class);

    private final List<BeforeToolHook> beforeHooks = new CopyOnWriteArrayList<>();
    private final List<AfterToolHook> afterHooks = new CopyOnWriteArrayList<>();

    public ToolCallHooks before(BeforeToolHook hook) {
        beforeHooks.add(hook);
        return this;
    }

    public ToolCallHooks after(AfterToolHook hook) {
        afterHooks.add(hook);
        return this;
    }

    /**
     * Runs only the before-hooks. An allowed outcome carries no result.
     */
    public HookOutcome evaluate(ToolCall toolCall) {
        for (BeforeToolHook hook : beforeHooks) {
            HookDecision decision;
            try {
                decision = hook.evaluate(toolCall);
            } catch (Exception e) {
                logger.warn("Before-hook failed for tool '{}'", toolCall.getName(), e);
                return HookOutcome.error(toolCall, "before-hook failed: " + e.getMessage(), e);
            }
            if (decision != null && !decision.isAllowed()) {
                logger.debug("Tool call '{}' denied: {}", toolCall.getName(), decision.getReason());
                return HookOutcome.denied(toolCall, decision.getReason());
            }
        }
        return HookOutcome.allowed(toolCall, null);
    }

    /**
     * Runs before-hooks, then the executor, then after-hooks.
     */
    public HookOutcome run(ToolCall toolCall, ToolExecutor executor) {
        HookOutcome check = evaluate(toolCall);
        if (!check.isAllowed()) {
            return check;
        }

        String result;
        try {
            result = executor.execute(toolCall);
        } catch (Exception e) {
            logger.warn("Tool '{}' failed", toolCall.getName(), e);
            return HookOutcome.error(toolCall, "tool failed: " + e.getMessage(), e);
        }

        for (AfterToolHook hook : afterHooks) {
            try {
                String replacement = hook.apply(toolCall, result);
                if (replacement != null) {
                    result = replacement;
                }
            } catch (Exception e) {
                logger.warn("After-hook failed for tool '{}'", toolCall.getName(), e);
                return HookOutcome.error(toolCall, "after-hook failed: " + e.getMessage(), e);
            }
        }
        return HookOutcome.allowed(toolCall, result);
    }

    public int getBeforeHookCount() {
        return beforeHooks.size();
    }

    public int getAfterHookCount() {
        return afterHooks.size();
    }
}
