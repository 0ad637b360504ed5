package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

public class MetadataUnavailableException extends GatewayException {
    public MetadataUnavailableException(String profileName, Throwable cause) {
        super(ResourceManager.getErrorMessage("metadata.tables.unavailable", profileName, cause.getMessage()), cause);
    }
}
