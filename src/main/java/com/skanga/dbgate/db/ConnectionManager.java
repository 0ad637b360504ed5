package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ConnectionProfile;
import com.skanga.dbgate.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the live connections, at most one per profile name.
 *
 * <p>A cached connection is probed before every reuse and transparently replaced when the
 * probe fails. All methods are synchronized so that closing and replacing a stale handle is
 * atomic with respect to the next acquisition.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final ServerConfig serverConfig;
    private final DatabaseDriver databaseDriver;
    private final Map<String, LiveConnection> liveConnections = new LinkedHashMap<>();

    public ConnectionManager(ServerConfig serverConfig, DatabaseDriver databaseDriver) {
        this.serverConfig = serverConfig;
        this.databaseDriver = databaseDriver;
    }

    /**
     * Resolves a profile name without connecting: the explicit name, else the configured
     * default, else the only profile if exactly one exists.
     *
     * @param profileName requested profile, may be null or empty
     * @throws UnknownProfileException if the name is not configured
     * @throws AmbiguousDefaultException if no name was given and it cannot be inferred
     */
    public ConnectionProfile resolveProfile(String profileName) throws UnknownProfileException, AmbiguousDefaultException {
        Map<String, ConnectionProfile> connections = serverConfig.connections();
        String resolvedName = profileName;
        if (resolvedName == null || resolvedName.isEmpty()) {
            if (serverConfig.defaultConnection() != null) {
                resolvedName = serverConfig.defaultConnection();
            } else if (connections.size() == 1) {
                resolvedName = connections.keySet().iterator().next();
            } else {
                throw new AmbiguousDefaultException(connections.size());
            }
        }

        ConnectionProfile connectionProfile = connections.get(resolvedName);
        if (connectionProfile == null) {
            throw new UnknownProfileException(resolvedName);
        }
        return connectionProfile;
    }

    /**
     * Returns a usable connection for the profile, reusing the cached one when its probe succeeds.
     *
     * @param profileName requested profile, may be null to use the default
     * @throws ConnectionFailedException if a new physical connection cannot be opened
     */
    public synchronized LiveConnection acquire(String profileName) throws GatewayException {
        ConnectionProfile connectionProfile = resolveProfile(profileName);
        String resolvedName = connectionProfile.name();

        LiveConnection existing = liveConnections.get(resolvedName);
        if (existing != null) {
            if (existing.probe()) {
                logger.debug("Reusing connection for profile '{}'", resolvedName);
                return existing;
            }
            logger.info("Replacing stale connection for profile '{}'", resolvedName);
            liveConnections.remove(resolvedName);
            existing.closeQuietly();
        }

        LiveConnection created = connect(connectionProfile);
        liveConnections.put(resolvedName, created);
        return created;
    }

    private LiveConnection connect(ConnectionProfile connectionProfile) throws ConnectionFailedException {
        ConnectRequest connectRequest = new ConnectRequest(
                connectionProfile.name(),
                connectionProfile.connectionString(),
                connectionProfile.driverQuirk().requiresExplicitAutocommit(),
                serverConfig.limits().timeoutSeconds());
        logger.info("Connecting: {}", connectRequest);

        try {
            Connection dbConn = databaseDriver.connect(connectRequest);
            logger.info("Connected to profile '{}'", connectionProfile.name());
            return new LiveConnection(connectionProfile.name(), dbConn);
        } catch (SQLException e) {
            logger.error("Connection to profile '{}' failed: {}", connectionProfile.name(), e.getMessage());
            throw new ConnectionFailedException(connectionProfile.name(), e);
        }
    }

    /**
     * Configured profile names in configuration order.
     */
    public List<String> profileNames() {
        return new ArrayList<>(serverConfig.connections().keySet());
    }

    public String defaultProfileName() {
        return serverConfig.defaultConnection();
    }

    public ServerConfig getServerConfig() {
        return serverConfig;
    }

    public DatabaseDriver getDatabaseDriver() {
        return databaseDriver;
    }

    public synchronized int activeConnectionCount() {
        return liveConnections.size();
    }

    /**
     * Closes every live connection, ignoring individual close errors. Safe to call repeatedly.
     */
    public synchronized void closeAll() {
        if (liveConnections.isEmpty()) {
            return;
        }
        logger.info("Closing {} live connection(s)", liveConnections.size());
        for (LiveConnection liveConnection : liveConnections.values()) {
            liveConnection.closeQuietly();
        }
        liveConnections.clear();
    }

    @Override
    public void close() {
        closeAll();
    }
}
