package com.homeostat.core.policy;

import com.homeostat.core.model.Mode;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated governance policy. Built once at startup by {@link PolicyLoader}.
 */
public final class GovernancePolicy {

    private final Map<Mode, ModePolicy> modes;
    private final List<TransitionRule> rules;
    private final Map<String, ToolPolicy> tools;
    private final Duration approvalTimeout;

    public GovernancePolicy(Map<Mode, ModePolicy> modes, List<TransitionRule> rules,
                            Map<String, ToolPolicy> tools, Duration approvalTimeout) {
        this.modes = Collections.unmodifiableMap(new EnumMap<>(modes));
        this.rules = List.copyOf(rules);
        this.tools = Map.copyOf(tools);
        this.approvalTimeout = approvalTimeout;
    }

    public ModePolicy mode(Mode mode) {
        ModePolicy policy = modes.get(mode);
        if (policy == null) {
            throw new PolicyException("No policy defined for mode " + mode);
        }
        return policy;
    }

    public Map<Mode, ModePolicy> modes() {
        return modes;
    }

    /** Outgoing rules of {@code source}, in priority order. */
    public List<TransitionRule> rulesFrom(Mode source) {
        return rules.stream()
                .filter(r -> r.source() == source)
                .sorted((a, b) -> Integer.compare(a.priority(), b.priority()))
                .toList();
    }

    public List<TransitionRule> rules() {
        return rules;
    }

    public Optional<ToolPolicy> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Map<String, ToolPolicy> tools() {
        return tools;
    }

    public Duration approvalTimeout() {
        return approvalTimeout;
    }
}
