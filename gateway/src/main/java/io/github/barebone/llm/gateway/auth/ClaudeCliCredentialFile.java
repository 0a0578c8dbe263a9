package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.gateway.BackendId;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * The credential file written by the Claude CLI ({@code ~/.claude/.credentials.json}).
 * Tokens live under {@code claudeAiOauth}; {@code expiresAt} is the raw expiry in epoch milliseconds.
 */
public class ClaudeCliCredentialFile extends JsonCredentialFile {

    static final String ENTRY = "claudeAiOauth";

    public ClaudeCliCredentialFile(Path path, ObjectMapper objectMapper) {
        super(path, objectMapper);
    }

    /**
     * The file in its default location under the given home directory.
     */
    public static ClaudeCliCredentialFile inHome(Path home, ObjectMapper objectMapper) {
        return new ClaudeCliCredentialFile(home.resolve(".claude").resolve(".credentials.json"), objectMapper);
    }

    @Override
    public boolean supports(BackendId backend) {
        return backend == BackendId.ANTHROPIC;
    }

    @Override
    protected Optional<OAuthCredentials> parse(BackendId backend, ObjectNode root) {
        JsonNode entry = root.get(ENTRY);
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        String accessToken = text(entry, "accessToken");
        if (accessToken == null || !entry.has("expiresAt")) {
            return Optional.empty();
        }
        return Optional.of(OAuthCredentials.fromRawExpiry(
                accessToken,
                text(entry, "refreshToken"),
                Instant.ofEpochMilli(entry.get("expiresAt").asLong()),
                null));
    }

    @Override
    protected void update(BackendId backend, ObjectNode root, OAuthCredentials credentials) {
        JsonNode existing = root.get(ENTRY);
        ObjectNode entry = existing instanceof ObjectNode ? (ObjectNode) existing : root.putObject(ENTRY);
        entry.put("accessToken", credentials.getAccessToken());
        entry.put("refreshToken", credentials.getRefreshToken());
        entry.put("expiresAt", credentials.getRawExpiry().toEpochMilli());
    }
}
