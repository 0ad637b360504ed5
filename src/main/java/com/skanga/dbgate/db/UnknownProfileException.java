package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

/**
 * The requested connection profile is not configured.
 */
public class UnknownProfileException extends GatewayException {
    private final String profileName;

    public UnknownProfileException(String profileName) {
        super(ResourceManager.getErrorMessage("connection.profile.unknown", profileName));
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
