package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.common.GatewayException;

/**
 * A model id resolved to a backend that has no adapter, or to no backend at all.
 */
public class NoProviderConfiguredException extends GatewayException {

    private final String modelId;

    public NoProviderConfiguredException(String backendId, String modelId, String message) {
        super(backendId, message, false);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
