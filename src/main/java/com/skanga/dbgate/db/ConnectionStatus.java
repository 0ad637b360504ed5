package com.skanga.dbgate.db;

import java.util.Optional;

/**
 * Outcome of a connection test. A successful test carries driver and server details; details
 * that could not be determined are {@code "Unknown"}, and the server version is absent when
 * the database does not support the version query. A failed test carries only the error.
 */
public record ConnectionStatus(
        String status,
        String connectionName,
        Optional<String> serverVersion,
        String driverName,
        String driverVersion,
        String database,
        String dbmsName,
        String dbmsVersion,
        String error
) {
    public static final String CONNECTED = "connected";
    public static final String ERROR = "error";
    public static final String UNKNOWN = "Unknown";

    public static ConnectionStatus connected(String connectionName, Optional<String> serverVersion,
                                             String driverName, String driverVersion, String database,
                                             String dbmsName, String dbmsVersion) {
        return new ConnectionStatus(CONNECTED, connectionName, serverVersion,
                driverName, driverVersion, database, dbmsName, dbmsVersion, null);
    }

    public static ConnectionStatus failed(String connectionName, String error) {
        return new ConnectionStatus(ERROR, connectionName, Optional.empty(), null, null, null, null, null, error);
    }

    public boolean isConnected() {
        return CONNECTED.equals(status);
    }
}
