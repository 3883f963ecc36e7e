package com.homeostat.core.policy;

import com.homeostat.core.model.Mode;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Static policy for one registered tool.
 * <p>
 * An empty {@code allowedInModes} places no per-tool restriction beyond the mode's
 * category allowlist. Empty path or command allowlists leave arguments unrestricted.
 */
public record ToolPolicy(
        String name,
        String category,
        Set<Mode> allowedInModes,
        Set<Mode> forbiddenInModes,
        Set<Mode> approvalInModes,
        boolean alwaysRequiresApproval,
        List<String> allowedPaths,
        List<String> forbiddenPaths,
        List<String> allowedCommands,
        List<String> forbiddenCommands,
        Integer rateLimitPerHour
) implements Serializable {

    public ToolPolicy {
        allowedInModes = Set.copyOf(allowedInModes);
        forbiddenInModes = Set.copyOf(forbiddenInModes);
        approvalInModes = Set.copyOf(approvalInModes);
        allowedPaths = List.copyOf(allowedPaths);
        forbiddenPaths = List.copyOf(forbiddenPaths);
        allowedCommands = List.copyOf(allowedCommands);
        forbiddenCommands = List.copyOf(forbiddenCommands);
    }

    public boolean permittedIn(Mode mode) {
        if (forbiddenInModes.contains(mode)) {
            return false;
        }
        return allowedInModes.isEmpty() || allowedInModes.contains(mode);
    }

    public boolean requiresApprovalIn(Mode mode) {
        return alwaysRequiresApproval || approvalInModes.contains(mode);
    }
}
