package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.gateway.BackendId;

import java.util.Locale;

/**
 * One entry of the routing table: a model id prefix and the backend it selects.
 */
public final class RouteRule {

    private final String prefix;
    private final BackendId backend;
    private final boolean stripPrefix;
    private final boolean ignoreCase;

    private RouteRule(String prefix, BackendId backend, boolean stripPrefix, boolean ignoreCase) {
        this.prefix = prefix;
        this.backend = backend;
        this.stripPrefix = stripPrefix;
        this.ignoreCase = ignoreCase;
    }

    /**
     * A namespace prefix, removed from the id sent to the backend
     */
    public static RouteRule namespace(String prefix, BackendId backend) {
        return new RouteRule(prefix, backend, true, false);
    }

    /**
     * A model family prefix, matched case-insensitively and kept in the id
     */
    public static RouteRule family(String prefix, BackendId backend) {
        return new RouteRule(prefix.toLowerCase(Locale.ROOT), backend, false, true);
    }

    public boolean matches(String modelId) {
        if (ignoreCase) {
            return modelId.toLowerCase(Locale.ROOT).startsWith(prefix);
        }
        return modelId.startsWith(prefix);
    }

    /**
     * The id the backend should see for a matching model id
     */
    public String localModelId(String modelId) {
        return stripPrefix ? modelId.substring(prefix.length()) : modelId;
    }

    public String getPrefix() {
        return prefix;
    }

    public BackendId getBackend() {
        return backend;
    }

    public boolean isStripPrefix() {
        return stripPrefix;
    }

    @Override
    public String toString() {
        return prefix + " -> " + backend;
    }
}
