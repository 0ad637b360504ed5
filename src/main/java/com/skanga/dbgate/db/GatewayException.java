package com.skanga.dbgate.db;

/**
 * Base class of the failures reported by the database gateway core.
 * Every subclass is terminal for the tool invocation that raised it.
 */
public abstract class GatewayException extends Exception {
    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
