package com.homeostat.core.governance;

import com.homeostat.core.policy.ToolPolicy;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;

/**
 * Matches a tool's path argument against its allowed and forbidden globs.
 * Paths that climb out of their root with {@code ..} are always refused.
 */
@Service
public class PathRestrictionService {

    public boolean isPathAllowed(ToolPolicy tool, String path) {
        Path normalised;
        try {
            normalised = Paths.get(path).normalize();
        } catch (InvalidPathException e) {
            return false;
        }
        if (normalised.startsWith("..")) {
            return false;
        }
        if (matchesAny(tool.forbiddenPaths(), normalised)) {
            return false;
        }
        return tool.allowedPaths().isEmpty() || matchesAny(tool.allowedPaths(), normalised);
    }

    private boolean matchesAny(List<String> globs, Path path) {
        for (String glob : globs) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
