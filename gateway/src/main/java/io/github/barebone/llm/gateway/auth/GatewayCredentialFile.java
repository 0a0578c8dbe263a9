package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * The gateway's own credential file, holding one entry per backend:
 * <pre>{@code
 * {
 *   "version": 1,
 *   "anthropic": {"access_token": "...", "refresh_token": "...", "expires_at": 1767225300},
 *   "openai-codex": {"access_token": "...", "refresh_token": "...", "expires_at": 1767225300, "account_id": "..."}
 * }
 * }</pre>
 * {@code expires_at} is in epoch seconds with the refresh margin already applied.
 */
public class GatewayCredentialFile extends JsonCredentialFile {

    private static final Logger logger = LoggerFactory.getLogger(GatewayCredentialFile.class);

    public GatewayCredentialFile(Path path, ObjectMapper objectMapper) {
        super(path, objectMapper);
    }

    @Override
    public boolean supports(BackendId backend) {
        return true;
    }

    @Override
    protected Optional<OAuthCredentials> parse(BackendId backend, ObjectNode root) {
        int version = root.path("version").asInt(GatewayConstants.CREDENTIAL_FILE_VERSION);
        if (version > GatewayConstants.CREDENTIAL_FILE_VERSION) {
            logger.warn("Credential file {} has unsupported version {}", path, version);
            return Optional.empty();
        }

        JsonNode entry = root.get(backend.getId());
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        String accessToken = text(entry, "access_token");
        if (accessToken == null || !entry.has("expires_at")) {
            logger.warn("Incomplete {} entry in {}", backend, path);
            return Optional.empty();
        }
        return Optional.of(new OAuthCredentials(
                accessToken,
                text(entry, "refresh_token"),
                Instant.ofEpochSecond(entry.get("expires_at").asLong()),
                text(entry, "account_id")));
    }

    @Override
    protected void update(BackendId backend, ObjectNode root, OAuthCredentials credentials) {
        root.put("version", GatewayConstants.CREDENTIAL_FILE_VERSION);
        ObjectNode entry = root.putObject(backend.getId());
        entry.put("access_token", credentials.getAccessToken());
        entry.put("refresh_token", credentials.getRefreshToken());
        entry.put("expires_at", credentials.getExpiresAt().getEpochSecond());
        if (credentials.getAccountId() != null) {
            entry.put("account_id", credentials.getAccountId());
        }
    }
}
