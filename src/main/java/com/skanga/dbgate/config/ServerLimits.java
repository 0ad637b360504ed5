package com.skanga.dbgate.config;

/**
 * Global limits applied to every connection.
 *
 * @param maxRows default maximum number of rows returned by a query (overridable per query)
 * @param timeoutSeconds login timeout applied when a physical connection is established
 */
public record ServerLimits(int maxRows, int timeoutSeconds) {
    public static final int DEFAULT_MAX_ROWS = 1000;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public ServerLimits {
        if (maxRows <= 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.max.rows.invalid", maxRows));
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.timeout.invalid", timeoutSeconds));
        }
    }

    public static ServerLimits defaults() {
        return new ServerLimits(DEFAULT_MAX_ROWS, DEFAULT_TIMEOUT_SECONDS);
    }
}
