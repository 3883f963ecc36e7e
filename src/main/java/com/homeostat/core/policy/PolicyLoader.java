package com.homeostat.core.policy;

import com.homeostat.core.model.Mode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates bound {@link PolicyProperties} and converts them into a {@link GovernancePolicy}.
 * Every problem found is reported in a single {@link PolicyException}.
 */
@Component
public class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(60);

    /** Transition graph used when a mode does not declare {@code transitions-to}. */
    static final Map<Mode, Set<Mode>> DEFAULT_TRANSITIONS = defaultTransitions();

    public GovernancePolicy load(PolicyProperties props) {
        var problems = new ArrayList<String>();

        var modes = new EnumMap<Mode, ModePolicy>(Mode.class);
        props.getModes().forEach((key, def) -> {
            Mode mode = parseMode(key, "modes", problems);
            if (mode != null) {
                if (modes.containsKey(mode)) {
                    problems.add("mode " + mode + " defined twice");
                } else {
                    modes.put(mode, toModePolicy(mode, def, problems));
                }
            }
        });
        for (Mode mode : Mode.values()) {
            if (!modes.containsKey(mode)) {
                problems.add("no policy defined for mode " + mode);
            }
        }

        var rules = new ArrayList<TransitionRule>();
        var ruleNames = new HashSet<String>();
        List<PolicyProperties.RuleDefinition> ruleDefs = props.getTransitionRules();
        for (int i = 0; i < ruleDefs.size(); i++) {
            TransitionRule rule = toRule(ruleDefs.get(i), i, problems);
            if (rule != null) {
                if (!ruleNames.add(rule.name())) {
                    problems.add("duplicate transition rule name " + rule.name());
                }
                rules.add(rule);
            }
        }

        var tools = new LinkedHashMap<String, ToolPolicy>();
        for (PolicyProperties.ToolDefinition def : props.getTools()) {
            ToolPolicy tool = toTool(def, problems);
            if (tool != null && tools.putIfAbsent(tool.name(), tool) != null) {
                problems.add("tool " + tool.name() + " defined twice");
            }
        }

        Duration approvalTimeout = props.getApprovalTimeout();
        if (approvalTimeout == null || approvalTimeout.isNegative() || approvalTimeout.isZero()) {
            problems.add("approval-timeout must be positive");
        }

        if (!problems.isEmpty()) {
            throw new PolicyException("Invalid governance policy: " + String.join("; ", problems));
        }

        warnOnUnreachableRules(rules, modes);
        log.info("Loaded governance policy: {} modes, {} transition rules, {} tools",
                modes.size(), rules.size(), tools.size());
        return new GovernancePolicy(modes, rules, tools, approvalTimeout);
    }

    private ModePolicy toModePolicy(Mode mode, PolicyProperties.ModeDefinition def, List<String> problems) {
        String where = "modes." + mode;
        Integer ceiling = def.getMaxConcurrentTasks();
        if (ceiling == null) {
            problems.add(where + ".max-concurrent-tasks is required");
            ceiling = 0;
        } else if (ceiling < 0) {
            problems.add(where + ".max-concurrent-tasks must be >= 0");
        }

        Duration stepTimeout = def.getStepTimeout() != null ? def.getStepTimeout() : DEFAULT_STEP_TIMEOUT;
        if (stepTimeout.isNegative() || stepTimeout.isZero()) {
            problems.add(where + ".step-timeout must be positive");
        }
        Duration sampling = def.getSamplingInterval();
        if (sampling != null && (sampling.isNegative() || sampling.isZero())) {
            problems.add(where + ".sampling-interval must be positive");
        }

        var roleLimits = new LinkedHashMap<String, ModelRoleLimits>();
        def.getModelLimits().forEach((role, limits) -> {
            if (limits.getMaxTokens() == null || limits.getMaxTokens() < 1) {
                problems.add(where + ".model-limits." + role + ".max-tokens must be >= 1");
                return;
            }
            double temperature = limits.getTemperature() != null ? limits.getTemperature() : 0.7;
            if (temperature < 0.0 || temperature > 2.0) {
                problems.add(where + ".model-limits." + role + ".temperature must be within [0, 2]");
            }
            roleLimits.put(normalise(role), new ModelRoleLimits(limits.getMaxTokens(), temperature, limits.getTimeout()));
        });

        PolicyProperties.RateLimitDefinition rate = def.getRateLimits();
        RateLimits rateLimits = rate == null
                ? RateLimits.unlimited()
                : new RateLimits(nonNegative(rate.getToolCallsPerMinute(), where + ".rate-limits.tool-calls-per-minute", problems),
                        nonNegative(rate.getModelCallsPerMinute(), where + ".rate-limits.model-calls-per-minute", problems));

        var thresholds = new LinkedHashMap<String, Double>();
        for (PolicyProperties.ThresholdDefinition t : def.getSignalThresholds()) {
            if (t.getMetric() == null || t.getMetric().isBlank() || t.getValue() == null) {
                problems.add(where + ".signal-thresholds entries need a metric and a value");
            } else {
                thresholds.put(t.getMetric(), t.getValue());
            }
        }

        Set<Mode> reachable = def.getTransitionsTo() == null
                ? DEFAULT_TRANSITIONS.get(mode)
                : parseModes(def.getTransitionsTo(), where + ".transitions-to", problems);

        return new ModePolicy(mode, def.getDescription(), ceiling,
                normaliseAll(def.getAllowedToolCategories()),
                normaliseAll(def.getRequireApprovalFor()),
                normaliseAll(def.getAllowedModelRoles()),
                roleLimits, rateLimits, stepTimeout, sampling, thresholds, reachable);
    }

    private TransitionRule toRule(PolicyProperties.RuleDefinition def, int index, List<String> problems) {
        String where = "transition-rules[" + index + "]";
        Mode from = parseMode(def.getFrom(), where + ".from", problems);
        Mode to = parseMode(def.getTo(), where + ".to", problems);
        if (from != null && from == to) {
            problems.add(where + " transitions " + from + " to itself");
        }

        Combinator combinator;
        try {
            combinator = Combinator.valueOf(String.valueOf(def.getCombinator()).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            problems.add(where + ".combinator must be ANY or ALL, got " + def.getCombinator());
            combinator = Combinator.ANY;
        }

        if (def.getConditions().isEmpty()) {
            problems.add(where + " has no conditions");
        }
        var conditions = new ArrayList<Condition>();
        for (int i = 0; i < def.getConditions().size(); i++) {
            PolicyProperties.ConditionDefinition c = def.getConditions().get(i);
            String cWhere = where + ".conditions[" + i + "]";
            if (c.getMetric() == null || c.getMetric().isBlank()) {
                problems.add(cWhere + ".metric is required");
                continue;
            }
            if (c.getThreshold() == null) {
                problems.add(cWhere + ".threshold is required");
                continue;
            }
            Operator operator;
            try {
                operator = Operator.parse(c.getOperator());
            } catch (PolicyException e) {
                problems.add(cWhere + ": " + e.getMessage());
                continue;
            }
            Duration sustained = c.getSustained() != null ? c.getSustained() : Duration.ZERO;
            if (sustained.isNegative()) {
                problems.add(cWhere + ".sustained must not be negative");
            }
            if (c.getWindow() != null && (c.getWindow().isNegative() || c.getWindow().isZero())) {
                problems.add(cWhere + ".window must be positive");
            }
            conditions.add(new Condition(c.getMetric(), operator, c.getThreshold(), sustained, c.getWindow()));
        }

        if (from == null || to == null) {
            return null;
        }
        String name = def.getName() != null && !def.getName().isBlank() ? def.getName() : from + "_to_" + to;
        return new TransitionRule(name, from, to, conditions, combinator, def.isRequiresApproval(), index);
    }

    private ToolPolicy toTool(PolicyProperties.ToolDefinition def, List<String> problems) {
        if (def.getName() == null || def.getName().isBlank()) {
            problems.add("tools entries need a name");
            return null;
        }
        String where = "tools." + def.getName();
        if (def.getCategory() == null || def.getCategory().isBlank()) {
            problems.add(where + ".category is required");
            return null;
        }
        return new ToolPolicy(def.getName(), normalise(def.getCategory()),
                parseModes(def.getAllowedInModes(), where + ".allowed-in-modes", problems),
                parseModes(def.getForbiddenInModes(), where + ".forbidden-in-modes", problems),
                parseModes(def.getRequiresApprovalInModes(), where + ".requires-approval-in-modes", problems),
                def.isRequiresApproval(),
                def.getAllowedPaths(), def.getForbiddenPaths(),
                def.getAllowedCommands(), def.getForbiddenCommands(),
                nonNegative(def.getRateLimitPerHour(), where + ".rate-limit-per-hour", problems));
    }

    private void warnOnUnreachableRules(List<TransitionRule> rules, Map<Mode, ModePolicy> modes) {
        for (TransitionRule rule : rules) {
            if (!modes.get(rule.source()).reachableModes().contains(rule.target())) {
                log.warn("Transition rule {} targets {} which is not reachable from {}; it will never apply",
                        rule.name(), rule.target(), rule.source());
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static Mode parseMode(String text, String where, List<String> problems) {
        if (text == null || text.isBlank()) {
            problems.add(where + " is required");
            return null;
        }
        try {
            return Mode.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            problems.add(where + ": unknown mode " + text);
            return null;
        }
    }

    private static Set<Mode> parseModes(Collection<String> names, String where, List<String> problems) {
        var modes = EnumSet.noneOf(Mode.class);
        for (String name : names) {
            Mode mode = parseMode(name, where, problems);
            if (mode != null) {
                modes.add(mode);
            }
        }
        return modes;
    }

    private static Integer nonNegative(Integer value, String where, List<String> problems) {
        if (value != null && value < 0) {
            problems.add(where + " must be >= 0");
        }
        return value;
    }

    private static String normalise(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> normaliseAll(Collection<String> names) {
        var out = new HashSet<String>();
        for (String name : names) {
            out.add(normalise(name));
        }
        return out;
    }

    private static Map<Mode, Set<Mode>> defaultTransitions() {
        var graph = new EnumMap<Mode, Set<Mode>>(Mode.class);
        graph.put(Mode.NORMAL, EnumSet.of(Mode.ALERT, Mode.DEGRADED));
        graph.put(Mode.ALERT, EnumSet.of(Mode.NORMAL, Mode.DEGRADED, Mode.LOCKDOWN));
        graph.put(Mode.DEGRADED, EnumSet.of(Mode.LOCKDOWN, Mode.RECOVERY));
        graph.put(Mode.LOCKDOWN, EnumSet.of(Mode.RECOVERY));
        graph.put(Mode.RECOVERY, EnumSet.of(Mode.NORMAL, Mode.ALERT));
        return graph;
    }
}
