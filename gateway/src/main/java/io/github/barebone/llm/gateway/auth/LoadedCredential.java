package io.github.barebone.llm.gateway.auth;

import java.util.Objects;

/**
 * A credential together with the source it was discovered in.
 */
public final class LoadedCredential {

    private final OAuthCredentials credentials;
    private final CredentialSource source;

    public LoadedCredential(OAuthCredentials credentials, CredentialSource source) {
        this.credentials = Objects.requireNonNull(credentials, "credentials cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    public OAuthCredentials getCredentials() {
        return credentials;
    }

    public CredentialSource getSource() {
        return source;
    }
}
