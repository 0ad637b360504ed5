package com.skanga.dbgate.tools;

/**
 * Text produced by a tool call. Failed calls are still results, flagged as errors, so that the
 * client can show the message instead of treating the call as a protocol failure.
 *
 * @param text result or error text
 * @param isError whether the call failed
 */
public record ToolResult(String text, boolean isError) {
    public static ToolResult success(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(text, true);
    }
}
