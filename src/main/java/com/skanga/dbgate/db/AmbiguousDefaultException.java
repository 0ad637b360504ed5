package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

/**
 * No profile was named, no default is configured and more than one profile exists.
 */
public class AmbiguousDefaultException extends GatewayException {
    public AmbiguousDefaultException(int profileCount) {
        super(ResourceManager.getErrorMessage("connection.default.ambiguous", profileCount));
    }
}
