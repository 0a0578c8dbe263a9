package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.gateway.BackendId;

import java.io.IOException;
import java.util.Optional;

/**
 * A place credentials can be discovered in: an OS vault or a JSON file.
 */
public interface CredentialSource {

    /**
     * Short name for log messages (e.g. "keychain", a file path)
     */
    String getName();

    /**
     * Whether this source can hold credentials for the backend
     */
    boolean supports(BackendId backend);

    /**
     * Reads the stored credential. A missing or unreadable store yields empty, never an error.
     */
    Optional<OAuthCredentials> read(BackendId backend);

    /**
     * Whether {@link #write} is supported
     */
    boolean isWritable();

    /**
     * Replaces the stored credential for the backend.
     *
     * @throws UnsupportedOperationException if the source is read-only
     */
    void write(BackendId backend, OAuthCredentials credentials) throws IOException;
}
