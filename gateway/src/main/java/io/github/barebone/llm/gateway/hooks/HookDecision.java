package io.github.barebone.llm.gateway.hooks;

/**
 * Verdict of a before-hook on a tool call.
 */
public final class HookDecision {

    private static final HookDecision ALLOW = new HookDecision(true, null);

    private final boolean allowed;
    private final String reason;

    private HookDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public boolean isAllowed() {
        return allowed;
    }

    /**
     * Why the call was denied; null when allowed
     */
    public String getReason() {
        return reason;
    }

    public static HookDecision allow() {
        return ALLOW;
    }

    public static HookDecision deny(String reason) {
        return new HookDecision(false, reason);
    }

    @Override
    public String toString() {
        return allowed ? "allow" : "deny(" + reason + ")";
    }
}
