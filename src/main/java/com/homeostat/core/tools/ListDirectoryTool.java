package com.homeostat.core.tools;

import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.model.ToolCall;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists a directory, one entry per line, directories suffixed with {@code /}.
 * Hidden entries are skipped unless {@code include_hidden} is {@code true}.
 */
@Component
public class ListDirectoryTool implements LocalTool {

    public static final String NAME = "list_directory";

    private final int maxEntries;

    public ListDirectoryTool(HomeostatProperties properties) {
        this.maxEntries = properties.getTools().getMaxDirectoryEntries();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String execute(ToolCall call) {
        Path dir = ToolArguments.requirePath(call);
        if (!Files.isDirectory(dir)) {
            throw new ToolExecutionException("Not a directory: " + dir);
        }
        boolean includeHidden = Boolean.parseBoolean(call.stringArgument("include_hidden"));
        try (Stream<Path> entries = Files.list(dir)) {
            String listing = entries
                    .filter(p -> includeHidden || !p.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .limit(maxEntries)
                    .map(p -> p.getFileName() + (Files.isDirectory(p) ? "/" : ""))
                    .collect(Collectors.joining("\n"));
            return listing.isEmpty() ? "(empty directory)" : listing;
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }
}
