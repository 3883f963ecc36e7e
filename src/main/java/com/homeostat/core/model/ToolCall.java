package com.homeostat.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A tool invocation requested by the model.
 */
public record ToolCall(
        String id,
        String name,
        Map<String, Object> arguments
) implements Serializable {

    public ToolCall {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * Returns the named argument as a string, or {@code null} when absent.
     */
    public String stringArgument(String key) {
        Object value = arguments.get(key);
        return value != null ? value.toString() : null;
    }
}
