package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

/**
 * A mutating statement was sent to a read-only profile. Nothing was executed.
 */
public class WriteNotAllowedException extends GatewayException {
    public WriteNotAllowedException(String profileName) {
        super(ResourceManager.getErrorMessage("query.write.not.allowed", profileName));
    }
}
