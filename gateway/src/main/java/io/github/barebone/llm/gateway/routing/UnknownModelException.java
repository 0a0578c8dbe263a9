package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.common.GatewayException;

/**
 * The model id is blank, or is a routing prefix with nothing after it.
 */
public class UnknownModelException extends GatewayException {

    private final String modelId;

    public UnknownModelException(String modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
