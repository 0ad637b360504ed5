package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ConnectionProfile;

/**
 * Everything a {@link DatabaseDriver} needs to open one physical connection.
 *
 * @param profileName profile the connection belongs to, used for logging
 * @param connectionString JDBC URL or {@code KEY=value;...} connection string
 * @param explicitAutocommit whether autocommit must be switched on right after connecting
 * @param timeoutSeconds login timeout
 */
public record ConnectRequest(String profileName, String connectionString, boolean explicitAutocommit, int timeoutSeconds) {
    @Override
    public String toString() {
        return String.format("ConnectRequest{profile='%s', connection='%s', explicitAutocommit=%s, timeout=%ds}",
                profileName, ConnectionProfile.maskSensitive(connectionString),
                explicitAutocommit, timeoutSeconds);
    }
}
