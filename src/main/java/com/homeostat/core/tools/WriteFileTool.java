package com.homeostat.core.tools;

import com.homeostat.core.model.ToolCall;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class WriteFileTool implements LocalTool {

    public static final String NAME = "write_file";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String execute(ToolCall call) {
        Path path = ToolArguments.requirePath(call);
        String content = call.stringArgument("content");
        if (content == null) {
            throw new ToolExecutionException("Missing required argument 'content'");
        }
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            return "Wrote " + content.getBytes(StandardCharsets.UTF_8).length + " bytes to " + path;
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }
}
