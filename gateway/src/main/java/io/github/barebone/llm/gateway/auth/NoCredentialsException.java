package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.common.GatewayException;

/**
 * Thrown when a token is requested but no credential was ever loaded or obtained.
 */
public class NoCredentialsException extends GatewayException {

    public NoCredentialsException(String backendId) {
        super(backendId, "No credentials for " + backendId + " - log in first", false);
    }
}
