package com.skanga.dbgate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The resolved server configuration: named connection profiles, an optional default profile
 * and the global limits. Validation happens here so that a bad configuration fails before
 * any database work starts.
 *
 * @param connections profiles keyed by name, in configuration order
 * @param defaultConnection name of the default profile, or null
 * @param limits global row and timeout limits
 */
public record ServerConfig(Map<String, ConnectionProfile> connections, String defaultConnection, ServerLimits limits) {
    public ServerConfig {
        connections = connections == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        if (defaultConnection != null && defaultConnection.isEmpty()) {
            defaultConnection = null;
        }
        if (defaultConnection != null && !connections.containsKey(defaultConnection)) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.default.not.found", defaultConnection));
        }
        if (limits == null) {
            limits = ServerLimits.defaults();
        }
    }

    /**
     * Convenience factory keying the given profiles by their names.
     */
    public static ServerConfig of(ServerLimits limits, String defaultConnection, ConnectionProfile... profiles) {
        Map<String, ConnectionProfile> connections = new LinkedHashMap<>();
        for (ConnectionProfile profile : profiles) {
            connections.put(profile.name(), profile);
        }
        return new ServerConfig(connections, defaultConnection, limits);
    }

    @Override
    public String toString() {
        return String.format("ServerConfig{connections=%s, default='%s', maxRows=%d, timeout=%ds}",
                connections.keySet(), defaultConnection, limits.maxRows(), limits.timeoutSeconds());
    }
}
