package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

/**
 * The driver rejected or failed to run a statement.
 */
public class ExecutionFailedException extends GatewayException {
    public ExecutionFailedException(String profileName, Throwable cause) {
        super(ResourceManager.getErrorMessage("query.execution.failed", profileName, cause.getMessage()), cause);
    }
}
