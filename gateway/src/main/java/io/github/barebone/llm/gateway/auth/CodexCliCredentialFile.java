package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The credential file written by the Codex CLI ({@code ~/.codex/auth.json}):
 * <pre>{@code
 * {"tokens": {"access_token": "...", "refresh_token": "...", "account_id": "..."}, "last_refresh": "2025-01-01T00:00:00Z"}
 * }</pre>
 * The CLI does not always record an expiry. When {@code tokens.expires_at} is absent the token
 * is assumed to live one hour from {@code last_refresh}, or from the file's modification time.
 */
public class CodexCliCredentialFile extends JsonCredentialFile {

    private static final Logger logger = LoggerFactory.getLogger(CodexCliCredentialFile.class);

    static final Duration ASSUMED_TOKEN_LIFETIME = Duration.ofHours(1);

    private final Clock clock;

    public CodexCliCredentialFile(Path path, ObjectMapper objectMapper, Clock clock) {
        super(path, objectMapper);
        this.clock = clock;
    }

    public static CodexCliCredentialFile inCodexHome(Path codexHome, ObjectMapper objectMapper, Clock clock) {
        return new CodexCliCredentialFile(codexHome.resolve("auth.json"), objectMapper, clock);
    }

    @Override
    public boolean supports(BackendId backend) {
        return backend == BackendId.OPENAI_CODEX;
    }

    @Override
    protected Optional<OAuthCredentials> parse(BackendId backend, ObjectNode root) {
        return parseAuthDocument(root, modificationTime(), objectMapper);
    }

    @Override
    protected void update(BackendId backend, ObjectNode root, OAuthCredentials credentials) {
        JsonNode existing = root.get("tokens");
        ObjectNode tokens = existing instanceof ObjectNode ? (ObjectNode) existing : root.putObject("tokens");
        tokens.put("access_token", credentials.getAccessToken());
        tokens.put("refresh_token", credentials.getRefreshToken());
        tokens.put("expires_at", credentials.getRawExpiry().getEpochSecond());
        if (credentials.getAccountId() != null) {
            tokens.put("account_id", credentials.getAccountId());
        }
        root.put("last_refresh", clock.instant().toString());
    }

    /**
     * Parses a Codex auth document, shared with the keychain entry which has the same shape.
     *
     * @param fallbackIssuedAt when the token is assumed to have been issued if the document does not say
     */
    static Optional<OAuthCredentials> parseAuthDocument(JsonNode root, Instant fallbackIssuedAt,
                                                        ObjectMapper objectMapper) {
        JsonNode tokens = root.path("tokens");
        String accessToken = text(tokens, "access_token");
        if (accessToken == null) {
            return Optional.empty();
        }

        String accountId = text(tokens, "account_id");
        if (accountId == null) {
            accountId = JwtClaims.extractAccountId(accessToken, objectMapper).orElse(null);
        }

        Instant rawExpiry;
        if (tokens.hasNonNull("expires_at")) {
            rawExpiry = Instant.ofEpochSecond(tokens.get("expires_at").asLong());
        } else {
            rawExpiry = lastRefresh(root).orElse(fallbackIssuedAt).plus(ASSUMED_TOKEN_LIFETIME);
        }

        return Optional.of(OAuthCredentials.fromRawExpiry(
                accessToken, text(tokens, "refresh_token"), rawExpiry, accountId));
    }

    private static Optional<Instant> lastRefresh(JsonNode root) {
        String value = text(root, "last_refresh");
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable last_refresh '{}'", value);
            return Optional.empty();
        }
    }

    private Instant modificationTime() {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            return clock.instant();
        }
    }
}
