package com.homeostat.core.mode;

import com.homeostat.core.model.Mode;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.policy.ModePolicy;
import com.homeostat.core.policy.ModelRoleLimits;
import com.homeostat.core.policy.RateLimits;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Limits in force for one mode. Derived from policy, never mutated; a mode change
 * publishes a new instance.
 */
public record ConstraintSet(
        Mode mode,
        Set<String> allowedCategories,
        Set<String> approvalCategories,
        Set<String> allowedModelRoles,
        int concurrencyCeiling,
        RateLimits rateLimits,
        Duration stepTimeout,
        Map<String, ModelRoleLimits> modelLimits,
        Duration samplingInterval,
        Map<String, Double> signalThresholds
) implements Serializable {

    public static ConstraintSet derive(Mode mode, GovernancePolicy policy) {
        ModePolicy p = policy.mode(mode);
        return new ConstraintSet(mode,
                p.allowedCategories(),
                p.approvalCategories(),
                p.allowedModelRoles(),
                p.maxConcurrentTasks(),
                p.rateLimits(),
                p.stepTimeout(),
                p.modelLimits(),
                p.samplingInterval(),
                p.signalThresholds());
    }

    public boolean allows(String category) {
        return allowedCategories.contains(category);
    }

    public boolean requiresApproval(String category) {
        return approvalCategories.contains(category);
    }

    public boolean allowsRole(String role) {
        return allowedModelRoles.contains(role);
    }

    public Optional<ModelRoleLimits> limitsFor(String role) {
        return Optional.ofNullable(modelLimits.get(role));
    }

    public Optional<Duration> samplingIntervalOverride() {
        return Optional.ofNullable(samplingInterval);
    }
}
