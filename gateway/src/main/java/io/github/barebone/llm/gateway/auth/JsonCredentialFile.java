package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * Base class for credential sources backed by a JSON file.
 * <p>
 * Reads tolerate a missing or corrupt file. Writes rewrite the whole file
 * through a temporary sibling and an atomic move, keeping every field this
 * class does not manage.
 */
public abstract class JsonCredentialFile implements CredentialSource {

    private static final Logger logger = LoggerFactory.getLogger(JsonCredentialFile.class);

    protected final Path path;
    protected final ObjectMapper objectMapper;

    protected JsonCredentialFile(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.toString();
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    @Override
    public Optional<OAuthCredentials> read(BackendId backend) {
        if (!supports(backend)) {
            return Optional.empty();
        }
        return readTree().flatMap(root -> parse(backend, root));
    }

    @Override
    public synchronized void write(BackendId backend, OAuthCredentials credentials) throws IOException {
        if (!supports(backend)) {
            throw new IllegalArgumentException(getName() + " cannot store credentials for " + backend);
        }
        ObjectNode root = readTree().orElseGet(objectMapper::createObjectNode);
        update(backend, root, credentials);
        writeAtomically(root);
        logger.debug("Saved {} credentials to {}", backend, path);
    }

    /**
     * Extracts the backend's credential from the file content.
     */
    protected abstract Optional<OAuthCredentials> parse(BackendId backend, ObjectNode root);

    /**
     * Stores the credential into the file content, in place.
     */
    protected abstract void update(BackendId backend, ObjectNode root, OAuthCredentials credentials);

    protected Optional<ObjectNode> readTree() {
        if (!Files.isRegularFile(path)) {
            logger.debug("Credential file not found: {}", path);
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(path.toFile());
            if (node == null || !node.isObject()) {
                logger.warn("Ignoring credential file {}: not a JSON object", path);
                return Optional.empty();
            }
            return Optional.of((ObjectNode) node);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable credential file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeAtomically(ObjectNode root) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            restrictPermissions(temp);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            logger.debug("Could not restrict permissions of {}: {}", file, e.getMessage());
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
