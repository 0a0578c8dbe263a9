package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Discovers stored OAuth credentials, trying each source in priority order.
 * The default order is the OS keychain, then the gateway's own credential file,
 * then the credential file of the backend's CLI.
 */
public class CredentialStore {

    private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);

    private final List<CredentialSource> sources;
    private final GatewayCredentialFile gatewayFile;

    public CredentialStore(List<CredentialSource> sources, GatewayCredentialFile gatewayFile) {
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
        this.gatewayFile = gatewayFile;
    }

    /**
     * Creates a store over the standard locations.
     *
     * @param home            the user's home directory
     * @param gatewayFilePath location of the gateway's own credential file
     */
    public static CredentialStore standard(Path home, Path gatewayFilePath, ObjectMapper objectMapper, Clock clock) {
        Path codexHome = home.resolve(".codex");
        GatewayCredentialFile gatewayFile = new GatewayCredentialFile(gatewayFilePath, objectMapper);

        List<CredentialSource> sources = new ArrayList<>();
        sources.add(new KeychainCredentialSource(codexHome, objectMapper, clock));
        sources.add(gatewayFile);
        sources.add(ClaudeCliCredentialFile.inHome(home, objectMapper));
        sources.add(CodexCliCredentialFile.inCodexHome(codexHome, objectMapper, clock));
        return new CredentialStore(sources, gatewayFile);
    }

    /**
     * Loads the first credential found for the backend. Empty means no source has one.
     */
    public Optional<LoadedCredential> load(BackendId backend) {
        for (CredentialSource source : sources) {
            if (!source.supports(backend)) {
                continue;
            }
            Optional<OAuthCredentials> credentials = source.read(backend);
            if (credentials.isPresent()) {
                logger.debug("Loaded {} credentials from {}", backend, source.getName());
                return Optional.of(new LoadedCredential(credentials.get(), source));
            }
        }
        logger.debug("No stored credentials for {}", backend);
        return Optional.empty();
    }

    public List<CredentialSource> getSources() {
        return sources;
    }

    /**
     * The gateway's own file, always written after a login or refresh
     */
    public GatewayCredentialFile getGatewayFile() {
        return gatewayFile;
    }
}
