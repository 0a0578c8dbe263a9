package io.github.barebone.llm.gateway;

import io.github.barebone.llm.common.GatewayConstants;

import java.util.Locale;
import java.util.Optional;

/**
 * The backends a request can be routed to.
 */
public enum BackendId {
    ANTHROPIC(GatewayConstants.BACKEND_ANTHROPIC, "Anthropic"),
    OPENROUTER(GatewayConstants.BACKEND_OPENROUTER, "OpenRouter"),
    OPENAI_CODEX(GatewayConstants.BACKEND_OPENAI_CODEX, "OpenAI Codex");

    private final String id;
    private final String displayName;

    BackendId(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a backend by its identifier, case-insensitively.
     */
    public static Optional<BackendId> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (BackendId backend : values()) {
            if (backend.id.equals(normalized)) {
                return Optional.of(backend);
            }
        }
        // Accept the short alias used in model prefixes
        if ("codex".equals(normalized)) {
            return Optional.of(OPENAI_CODEX);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
