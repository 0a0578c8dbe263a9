package io.github.barebone.llm.common;

/**
 * Constants used throughout the LLM Gateway.
 */
public final class GatewayConstants {

    private GatewayConstants() {
        // Prevent instantiation
    }

    // Backend Identifiers
    public static final String BACKEND_ANTHROPIC = "anthropic";
    public static final String BACKEND_OPENROUTER = "openrouter";
    public static final String BACKEND_OPENAI_CODEX = "openai-codex";

    // Stop Reasons
    public static final String STOP_END_TURN = "end_turn";
    public static final String STOP_TOOL_USE = "tool_use";
    public static final String STOP_TOOL_CALLS = "tool_calls";

    // Request Defaults
    public static final int DEFAULT_MAX_TOKENS = 8192;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 300000;

    // Credentials
    public static final long TOKEN_REFRESH_MARGIN_SECONDS = 300;
    public static final int CREDENTIAL_FILE_VERSION = 1;

    // OAuth
    public static final long DEFAULT_CALLBACK_TIMEOUT_MS = 120000;
}
