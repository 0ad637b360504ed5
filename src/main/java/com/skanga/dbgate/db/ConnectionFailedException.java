package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

/**
 * The driver could not establish a physical connection.
 */
public class ConnectionFailedException extends GatewayException {
    public ConnectionFailedException(String profileName, Throwable cause) {
        super(ResourceManager.getErrorMessage("connection.failed", profileName, cause.getMessage()), cause);
    }
}
