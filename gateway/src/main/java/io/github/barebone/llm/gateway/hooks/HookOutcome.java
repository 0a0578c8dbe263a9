package io.github.barebone.llm.gateway.hooks;

import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ToolCall;

/**
 * Result of running a tool call through the hooks.
 * <p>
 * A denial is an ordinary outcome, kept apart from failures of a hook or of
 * the tool itself.
 */
public final class HookOutcome {

    public enum Status {
        ALLOWED,
        DENIED,
        ERROR
    }

    private final ToolCall toolCall;
    private final Status status;
    private final String result;
    private final String reason;
    private final Exception error;

    private HookOutcome(ToolCall toolCall, Status status, String result, String reason, Exception error) {
        this.toolCall = toolCall;
        this.status = status;
        this.result = result;
        this.reason = reason;
        this.error = error;
    }

    static HookOutcome allowed(ToolCall toolCall, String result) {
        return new HookOutcome(toolCall, Status.ALLOWED, result, null, null);
    }

    static HookOutcome denied(ToolCall toolCall, String reason) {
        return new HookOutcome(toolCall, Status.DENIED, null, reason, null);
    }

    static HookOutcome error(ToolCall toolCall, String reason, Exception error) {
        return new HookOutcome(toolCall, Status.ERROR, null, reason, error);
    }

    public ToolCall getToolCall() {
        return toolCall;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAllowed() {
        return status == Status.ALLOWED;
    }

    public boolean isDenied() {
        return status == Status.DENIED;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * Tool output after the after-hooks; null unless allowed and executed
     */
    public String getResult() {
        return result;
    }

    /**
     * Denial reason or error description
     */
    public String getReason() {
        return reason;
    }

    public Exception getError() {
        return error;
    }

    /**
     * The tool result message to send back to the model for this call.
     */
    public Message toMessage() {
        switch (status) {
            case ALLOWED:
                return Message.toolResult(toolCall.getId(), toolCall.getName(), result != null ? result : "");
            case DENIED:
                return Message.toolResult(toolCall.getId(), toolCall.getName(), "Denied: " + reason, true);
            default:
                return Message.toolResult(toolCall.getId(), toolCall.getName(), "Error: " + reason, true);
        }
    }

    @Override
    public String toString() {
        return "HookOutcome{" + toolCall.getName() + ", " + status +
                (reason != null ? ", reason=" + reason : "") + "}";
    }
}
