package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.BackendAdapter;

/**
 * Result of routing a model id: the backend, its adapter and the model id to send it.
 */
public final class Route {

    private final BackendId backendId;
    private final BackendAdapter adapter;
    private final String localModelId;

    public Route(BackendId backendId, BackendAdapter adapter, String localModelId) {
        this.backendId = backendId;
        this.adapter = adapter;
        this.localModelId = localModelId;
    }

    public BackendId getBackendId() {
        return backendId;
    }

    public BackendAdapter getAdapter() {
        return adapter;
    }

    public String getLocalModelId() {
        return localModelId;
    }

    @Override
    public String toString() {
        return "Route{" + backendId + ", model=" + localModelId + "}";
    }
}
