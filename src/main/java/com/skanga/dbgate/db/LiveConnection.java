package com.skanga.dbgate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * A physical connection owned by the {@link ConnectionManager} for exactly one profile.
 */
public final class LiveConnection {
    private static final Logger logger = LoggerFactory.getLogger(LiveConnection.class);
    static final String PROBE_SQL = "SELECT 1";

    private final String profileName;
    private final Connection connection;
    private final Instant createdAt;

    LiveConnection(String profileName, Connection connection) {
        this.profileName = profileName;
        this.connection = connection;
        this.createdAt = Instant.now();
    }

    public String getProfileName() {
        return profileName;
    }

    public Connection getConnection() {
        return connection;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Runs a trivial statement to check the connection is still usable.
     *
     * @return true if the probe succeeded
     */
    boolean probe() {
        try (Statement probeStmt = connection.createStatement();
             ResultSet resultSet = probeStmt.executeQuery(PROBE_SQL)) {
            resultSet.next();
            return true;
        } catch (SQLException e) {
            logger.warn("Connection probe failed for profile '{}': {}", profileName, e.getMessage());
            return false;
        }
    }

    /**
     * Closes the physical connection. Close failures are logged and otherwise ignored
     * because the handle is being discarded either way.
     */
    void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.debug("Ignoring error while closing connection for profile '{}'", profileName, e);
        }
    }

    @Override
    public String toString() {
        return "LiveConnection{profile='" + profileName + "', createdAt=" + createdAt + "}";
    }
}
