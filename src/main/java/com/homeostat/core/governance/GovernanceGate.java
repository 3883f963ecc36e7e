package com.homeostat.core.governance;

import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.mode.ConstraintSet;
import com.homeostat.core.mode.ModeSnapshot;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.Mode;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.policy.ModelRoleLimits;
import com.homeostat.core.policy.ToolPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether a capability may be used in the active mode.
 * <p>
 * Each check reads one {@link ModeSnapshot} and evaluates, in order: category resolution
 * (unknown tools are denied), category and argument restrictions, approval requirements,
 * then rate limits. Only an {@code ALLOWED} outcome consumes rate-limit budget or a
 * concurrency slot.
 */
@Service
public class GovernanceGate {

    private static final Logger log = LoggerFactory.getLogger(GovernanceGate.class);

    public static final String MODEL_CATEGORY = "model";
    public static final String CONCURRENCY_CATEGORY = "concurrency";
    public static final String UNKNOWN_CATEGORY = "unknown";

    static final String PATH_ARGUMENT = "path";
    static final String COMMAND_ARGUMENT = "command";

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final GovernancePolicy policy;
    private final ModeView modeView;
    private final SlidingWindowRateLimiter rateLimiter;
    private final PathRestrictionService pathRestrictions;
    private final CommandAllowlistService commandAllowlist;
    private final HomeostatMetrics metrics;
    private final Clock clock;
    private final AtomicInteger slotsInUse = new AtomicInteger();

    public GovernanceGate(GovernancePolicy policy, ModeView modeView, SlidingWindowRateLimiter rateLimiter,
                          PathRestrictionService pathRestrictions, CommandAllowlistService commandAllowlist,
                          HomeostatMetrics metrics, Clock clock) {
        this.policy = policy;
        this.modeView = modeView;
        this.rateLimiter = rateLimiter;
        this.pathRestrictions = pathRestrictions;
        this.commandAllowlist = commandAllowlist;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Checks {@code capability} against the current mode.
     *
     * @param context the requesting task, used for log correlation; may be {@code null}
     */
    public Decision check(Capability capability, ExecutionContext context) {
        return decide(capability, context, false);
    }

    /**
     * Re-checks a capability an operator has approved: restrictions still apply,
     * the approval requirement does not.
     */
    public Decision admitApproved(Capability capability, ExecutionContext context) {
        return decide(capability, context, true);
    }

    /** Returns a concurrency slot taken by an allowed {@link Capability#concurrencySlot()} check. */
    public void releaseSlot() {
        slotsInUse.updateAndGet(n -> Math.max(0, n - 1));
    }

    public int slotsInUse() {
        return slotsInUse.get();
    }

    /**
     * Token budget, timeout and rate that apply to {@code capability} in the current mode.
     */
    public EffectiveLimits limitsFor(Capability capability) {
        ConstraintSet constraints = modeView.current().constraints();
        return switch (capability.kind()) {
            case MODEL_ROLE -> {
                Optional<ModelRoleLimits> role = constraints.limitsFor(capability.name());
                Duration timeout = role.map(ModelRoleLimits::timeout).orElse(null);
                yield new EffectiveLimits(
                        role.map(ModelRoleLimits::maxTokens).orElse(null),
                        role.map(ModelRoleLimits::temperature).orElse(null),
                        timeout != null ? timeout : constraints.stepTimeout(),
                        constraints.rateLimits().modelCallsPerMinute(), MINUTE);
            }
            case TOOL -> {
                Integer perHour = policy.tool(capability.name()).map(ToolPolicy::rateLimitPerHour).orElse(null);
                Integer perMinute = constraints.rateLimits().toolCallsPerMinute();
                boolean minuteIsTighter = perMinute != null && (perHour == null || perMinute * 60 <= perHour);
                yield new EffectiveLimits(null, null, constraints.stepTimeout(),
                        minuteIsTighter ? perMinute : perHour,
                        minuteIsTighter ? MINUTE : (perHour != null ? HOUR : null));
            }
            case CONCURRENCY -> new EffectiveLimits(null, null, null, constraints.concurrencyCeiling(), null);
        };
    }

    private Decision decide(Capability capability, ExecutionContext context, boolean approved) {
        ModeSnapshot snapshot = modeView.current();
        Decision decision = switch (capability.kind()) {
            case TOOL -> checkTool(capability, snapshot, approved);
            case MODEL_ROLE -> checkModelRole(capability, snapshot, approved);
            case CONCURRENCY -> checkConcurrency(snapshot);
        };

        metrics.recordDecision(decision.verdict().name(), decision.category());
        String traceId = context != null ? context.traceId() : "-";
        if (decision.isDenied()) {
            log.info("[{}] {} denied in {}: {}", traceId, capability.describe(), snapshot.mode(), decision.reason());
        } else {
            log.debug("[{}] {} -> {} in {}", traceId, capability.describe(), decision.verdict(), snapshot.mode());
        }
        return decision;
    }

    private Decision checkTool(Capability capability, ModeSnapshot snapshot, boolean approved) {
        Optional<ToolPolicy> registered = policy.tool(capability.name());
        if (registered.isEmpty()) {
            return Decision.denied(UNKNOWN_CATEGORY, "tool '" + capability.name() + "' is not registered");
        }
        ToolPolicy tool = registered.get();
        String category = tool.category();
        Mode mode = snapshot.mode();
        ConstraintSet constraints = snapshot.constraints();

        if (!constraints.allows(category)) {
            return Decision.denied(category, "category '" + category + "' is not permitted in " + mode);
        }
        if (!tool.permittedIn(mode)) {
            return Decision.denied(category, "tool '" + tool.name() + "' is not permitted in " + mode);
        }
        Object path = capability.arguments().get(PATH_ARGUMENT);
        if (path != null && !pathRestrictions.isPathAllowed(tool, path.toString())) {
            return Decision.denied(category, "path '" + path + "' is outside the allowed paths");
        }
        Object command = capability.arguments().get(COMMAND_ARGUMENT);
        if (command != null && !commandAllowlist.isCommandAllowed(tool, command.toString())) {
            return Decision.denied(category, "command is not on the allowlist");
        }

        if (!approved && (constraints.requiresApproval(category) || tool.requiresApprovalIn(mode))) {
            return Decision.requiresApproval(category,
                    "tool '" + tool.name() + "' (" + category + ") requires approval in " + mode);
        }

        var limits = new ArrayList<SlidingWindowRateLimiter.Limit>();
        Integer perMinute = constraints.rateLimits().toolCallsPerMinute();
        if (perMinute != null) {
            limits.add(new SlidingWindowRateLimiter.Limit("tool_calls", perMinute, MINUTE));
        }
        if (tool.rateLimitPerHour() != null) {
            limits.add(new SlidingWindowRateLimiter.Limit("tool:" + tool.name(), tool.rateLimitPerHour(), HOUR));
        }
        return consume(category, limits, "rate limit exceeded for tool '" + tool.name() + "'");
    }

    private Decision checkModelRole(Capability capability, ModeSnapshot snapshot, boolean approved) {
        String role = capability.name();
        ConstraintSet constraints = snapshot.constraints();
        if (!constraints.allowsRole(role)) {
            return Decision.denied(MODEL_CATEGORY, "model role '" + role + "' is not permitted in " + snapshot.mode());
        }
        if (!approved && constraints.requiresApproval(MODEL_CATEGORY)) {
            return Decision.requiresApproval(MODEL_CATEGORY, "model calls require approval in " + snapshot.mode());
        }
        Integer perMinute = constraints.rateLimits().modelCallsPerMinute();
        List<SlidingWindowRateLimiter.Limit> limits = perMinute == null
                ? List.of()
                : List.of(new SlidingWindowRateLimiter.Limit("model_calls", perMinute, MINUTE));
        return consume(MODEL_CATEGORY, limits, "model call rate limit exceeded");
    }

    private Decision checkConcurrency(ModeSnapshot snapshot) {
        int ceiling = snapshot.constraints().concurrencyCeiling();
        if (ceiling == 0) {
            return Decision.denied(CONCURRENCY_CATEGORY, "no new tasks are admitted in " + snapshot.mode());
        }
        while (true) {
            int inUse = slotsInUse.get();
            if (inUse >= ceiling) {
                return Decision.denied(CONCURRENCY_CATEGORY,
                        "concurrency ceiling of " + ceiling + " reached in " + snapshot.mode());
            }
            if (slotsInUse.compareAndSet(inUse, inUse + 1)) {
                return Decision.allowed(CONCURRENCY_CATEGORY);
            }
        }
    }

    private Decision consume(String category, List<SlidingWindowRateLimiter.Limit> limits, String reason) {
        if (limits.isEmpty() || rateLimiter.tryAcquireAll(limits, clock.instant())) {
            return Decision.allowed(category);
        }
        return Decision.denied(category, reason);
    }
}
