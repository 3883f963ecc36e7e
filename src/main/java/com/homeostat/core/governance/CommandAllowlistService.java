package com.homeostat.core.governance;

import com.homeostat.core.policy.ToolPolicy;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Matches shell commands against a tool's allowed and forbidden patterns.
 * A trailing {@code *} matches any suffix; anything else must match exactly.
 */
@Service
public class CommandAllowlistService {

    public boolean isCommandAllowed(ToolPolicy tool, String command) {
        String trimmed = command.trim();
        if (matchesAny(tool.forbiddenCommands(), trimmed)) {
            return false;
        }
        return tool.allowedCommands().isEmpty() || matchesAny(tool.allowedCommands(), trimmed);
    }

    private boolean matchesAny(List<String> patterns, String command) {
        for (String pattern : patterns) {
            if (matches(pattern, command)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String command) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return command.startsWith(prefix);
        }
        return pattern.equals(command);
    }
}
