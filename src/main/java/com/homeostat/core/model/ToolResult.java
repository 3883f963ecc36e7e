package com.homeostat.core.model;

import java.io.Serializable;

/**
 * Outcome of one tool invocation. A failed call carries {@code error} instead of output.
 */
public record ToolResult(
        String callId,
        String toolName,
        boolean success,
        String output,
        String error,
        long latencyMs
) implements Serializable {

    public static ToolResult success(String callId, String toolName, String output, long latencyMs) {
        return new ToolResult(callId, toolName, true, output, null, latencyMs);
    }

    public static ToolResult failure(String callId, String toolName, String error, long latencyMs) {
        return new ToolResult(callId, toolName, false, null, error, latencyMs);
    }

    /** Text handed back to the model as the tool message content. */
    public String content() {
        return success ? output : "Error: " + error;
    }
}
