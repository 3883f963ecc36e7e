package com.homeostat.core.tools;

import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.model.ToolCall;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a UTF-8 text file up to the configured size limit.
 */
@Component
public class ReadFileTool implements LocalTool {

    public static final String NAME = "read_file";

    private final long maxBytes;

    public ReadFileTool(HomeostatProperties properties) {
        this.maxBytes = properties.getTools().getMaxReadBytes();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String execute(ToolCall call) {
        Path path = ToolArguments.requirePath(call);
        if (!Files.isRegularFile(path)) {
            throw new ToolExecutionException("Not a file: " + path);
        }
        try {
            long size = Files.size(path);
            if (size > maxBytes) {
                throw new ToolExecutionException("File size " + size + " bytes exceeds limit " + maxBytes + " bytes");
            }
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
