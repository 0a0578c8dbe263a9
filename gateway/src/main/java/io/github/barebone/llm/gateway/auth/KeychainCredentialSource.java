package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads Codex CLI credentials from the macOS keychain through the {@code security} tool.
 * The entry is keyed by a hash of the Codex home directory. Read-only, and empty on other platforms.
 */
public class KeychainCredentialSource implements CredentialSource {

    private static final Logger logger = LoggerFactory.getLogger(KeychainCredentialSource.class);

    static final String SERVICE = "Codex Auth";
    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private final Path codexHome;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;
    private final Duration commandTimeout;

    public KeychainCredentialSource(Path codexHome, ObjectMapper objectMapper, Clock clock) {
        this(codexHome, objectMapper, clock, isMacOs());
    }

    KeychainCredentialSource(Path codexHome, ObjectMapper objectMapper, Clock clock, boolean enabled) {
        this(codexHome, objectMapper, clock, enabled, COMMAND_TIMEOUT);
    }

    KeychainCredentialSource(Path codexHome, ObjectMapper objectMapper, Clock clock, boolean enabled,
                             Duration commandTimeout) {
        this.codexHome = codexHome;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = enabled;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public String getName() {
        return "keychain";
    }

    @Override
    public boolean supports(BackendId backend) {
        return enabled && backend == BackendId.OPENAI_CODEX;
    }

    @Override
    public Optional<OAuthCredentials> read(BackendId backend) {
        if (!supports(backend)) {
            return Optional.empty();
        }
        Optional<String> secret = findPassword(SERVICE, accountName());
        if (secret.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode document = objectMapper.readTree(secret.get());
            return CodexCliCredentialFile.parseAuthDocument(document, clock.instant(), objectMapper);
        } catch (IOException e) {
            logger.warn("Ignoring keychain entry that is not valid JSON");
            return Optional.empty();
        }
    }

    @Override
    public boolean isWritable() {
        return false;
    }

    @Override
    public void write(BackendId backend, OAuthCredentials credentials) {
        throw new UnsupportedOperationException("The keychain credential source is read-only");
    }

    /**
     * Account name of the keychain entry: {@code cli|} plus the first 16 hex digits
     * of the SHA-256 of the Codex home path.
     */
    String accountName() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codexHome.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return "cli|" + hex.substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Command that prints the stored secret on stdout.
     */
    protected List<String> passwordCommand(String service, String account) {
        return List.of("security", "find-generic-password", "-s", service, "-a", account, "-w");
    }

    /**
     * Runs {@link #passwordCommand} and returns the stored secret. A command that does
     * not exit within the timeout is killed and treated as no entry.
     */
    protected Optional<String> findPassword(String service, String account) {
        ProcessBuilder builder = new ProcessBuilder(passwordCommand(service, account));
        builder.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            logger.debug("Keychain lookup failed: {}", e.getMessage());
            return Optional.empty();
        }

        // stdout is read on its own thread so a hung command cannot block past the timeout
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> {
            try (InputStream stdout = process.getInputStream()) {
                return new String(stdout.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        try {
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                output.cancel(true);
                logger.warn("Keychain lookup timed out after {}ms", commandTimeout.toMillis());
                return Optional.empty();
            }
            String secret = output.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0 || secret.isEmpty()) {
                logger.debug("No keychain entry for service '{}'", service);
                return Optional.empty();
            }
            return Optional.of(secret);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            logger.debug("Keychain lookup failed: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static boolean isMacOs() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }
}
