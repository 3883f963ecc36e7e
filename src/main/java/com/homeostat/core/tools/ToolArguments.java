package com.homeostat.core.tools;

import com.homeostat.core.model.ToolCall;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

final class ToolArguments {

    private ToolArguments() {}

    static Path requirePath(ToolCall call) {
        String raw = call.stringArgument("path");
        if (raw == null || raw.isBlank()) {
            throw new ToolExecutionException("Missing required argument 'path'");
        }
        String expanded = raw.startsWith("~/") ? System.getProperty("user.home") + raw.substring(1) : raw;
        try {
            return Path.of(expanded).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ToolExecutionException("Invalid path: " + raw, e);
        }
    }
}
