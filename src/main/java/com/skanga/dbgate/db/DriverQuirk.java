package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ResourceManager;

import java.util.Locale;

/**
 * Driver-specific connection behaviour, resolved once per profile.
 */
public enum DriverQuirk {
    /** No special handling. */
    NONE,
    /** Autocommit must be switched on explicitly right after the connection is opened (ProvideX/Sage 100). */
    EXPLICIT_AUTOCOMMIT;

    private static final String PROVIDEX_MARKER = "PROVIDEX";
    private static final String SAGE100_PROFILE = "SAGE100";

    public boolean requiresExplicitAutocommit() {
        return this == EXPLICIT_AUTOCOMMIT;
    }

    /**
     * Detects the quirk from the profile name and its connection string.
     */
    public static DriverQuirk detect(String profileName, String connectionString) {
        if (connectionString != null && connectionString.toUpperCase(Locale.ROOT).contains(PROVIDEX_MARKER)) {
            return EXPLICIT_AUTOCOMMIT;
        }
        if (profileName != null && profileName.toUpperCase(Locale.ROOT).equals(SAGE100_PROFILE)) {
            return EXPLICIT_AUTOCOMMIT;
        }
        return NONE;
    }

    /**
     * Parses a configured quirk name. Returns null when nothing is configured so detection applies.
     *
     * @throws IllegalArgumentException for an unknown quirk name
     */
    public static DriverQuirk fromConfigValue(String configValue) {
        if (configValue == null || configValue.trim().isEmpty()) {
            return null;
        }
        String normalized = configValue.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DriverQuirk driverQuirk : values()) {
            if (driverQuirk.name().equals(normalized)) {
                return driverQuirk;
            }
        }
        throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.driver.quirk.invalid", configValue));
    }
}
