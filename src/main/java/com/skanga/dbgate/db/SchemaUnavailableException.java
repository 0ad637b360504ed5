package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

public class SchemaUnavailableException extends GatewayException {
    public SchemaUnavailableException(String tableName, Throwable cause) {
        super(ResourceManager.getErrorMessage("metadata.schema.unavailable", tableName, cause.getMessage()), cause);
    }
}
