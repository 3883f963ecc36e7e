package com.homeostat.core.policy;

import com.homeostat.core.model.Mode;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Validated policy for one mode.
 */
public record ModePolicy(
        Mode mode,
        String description,
        int maxConcurrentTasks,
        Set<String> allowedCategories,
        Set<String> approvalCategories,
        Set<String> allowedModelRoles,
        Map<String, ModelRoleLimits> modelLimits,
        RateLimits rateLimits,
        Duration stepTimeout,
        Duration samplingInterval,
        Map<String, Double> signalThresholds,
        Set<Mode> reachableModes
) implements Serializable {

    public ModePolicy {
        allowedCategories = Set.copyOf(allowedCategories);
        approvalCategories = Set.copyOf(approvalCategories);
        allowedModelRoles = Set.copyOf(allowedModelRoles);
        modelLimits = Map.copyOf(modelLimits);
        signalThresholds = Map.copyOf(signalThresholds);
        reachableModes = Set.copyOf(reachableModes);
    }
}
