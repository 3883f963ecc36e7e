package com.homeostat.core.mode;

import com.homeostat.core.approval.ApprovalRequest;
import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.approval.PendingApproval;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.model.Mode;
import com.homeostat.core.policy.Condition;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.policy.TransitionRule;
import com.homeostat.core.sensor.ControlSignal;
import com.homeostat.core.sensor.MetricSample;
import com.homeostat.core.sensor.MetricSink;
import com.homeostat.core.sensor.MetricWindow;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole owner of the operating mode.
 * <p>
 * Samples, control signals, approval outcomes and the periodic tick are all processed on
 * one actor thread, so rule state is never touched concurrently. Other components read
 * the published {@link ModeSnapshot}, which is replaced as a whole on every transition.
 * A transition only affects the next governance check; running steps are never preempted.
 */
@Service
public class ModeController implements ModeView, MetricSink {

    private static final Logger log = LoggerFactory.getLogger(ModeController.class);

    private final GovernancePolicy policy;
    private final ApprovalService approvals;
    private final EventBus eventBus;
    private final HomeostatMetrics metrics;
    private final Clock clock;
    private final HomeostatProperties.Controller config;

    private final ScheduledExecutorService actor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mode-controller");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<ModeSnapshot> snapshot = new AtomicReference<>();
    private final Queue<ControlSignal> signals = new ConcurrentLinkedQueue<>();
    private final ArrayDeque<ModeTransition> history = new ArrayDeque<>();
    private volatile String pendingApprovalId;

    // Actor-confined state
    private final Map<String, Observation> observations = new HashMap<>();
    private final Map<String, RuleTracker> trackers = new LinkedHashMap<>();
    private MetricWindow window;
    private PendingTransition pending;

    private record Observation(double value, Instant timestamp) {}

    private record PendingTransition(String approvalId, TransitionRule rule, RuleTracker.Trigger trigger) {}

    public ModeController(GovernancePolicy policy, ApprovalService approvals, EventBus eventBus,
                          HomeostatMetrics metrics, Clock clock, HomeostatProperties properties) {
        this.policy = policy;
        this.approvals = approvals;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getController();
        this.window = MetricWindow.empty(config.getWindowCapacity());
        this.snapshot.set(new ModeSnapshot(Mode.NORMAL, ConstraintSet.derive(Mode.NORMAL, policy),
                clock.instant(), 0, "initial"));
    }

    @PostConstruct
    void start() {
        if (!config.isEnabled()) {
            log.info("Mode controller tick disabled; mode changes only on samples and signals");
            return;
        }
        long tickMs = config.getTickInterval().toMillis();
        actor.scheduleAtFixedRate(this::tickSafely, tickMs, tickMs, TimeUnit.MILLISECONDS);
        log.info("Mode controller started in {} (tick={}ms)", current().mode(), tickMs);
    }

    @PreDestroy
    void stop() {
        actor.shutdown();
        try {
            if (!actor.awaitTermination(5, TimeUnit.SECONDS)) {
                actor.shutdownNow();
            }
        } catch (InterruptedException e) {
            actor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Mode controller stopped in {}", current().mode());
    }

    @Override
    public ModeSnapshot current() {
        return snapshot.get();
    }

    @Override
    public void onSample(MetricSample sample) {
        enqueue(() -> processSample(sample));
    }

    @Override
    public void onSignal(ControlSignal signal) {
        signals.offer(signal);
        enqueue(this::drainSignals);
    }

    /** Applied transitions, oldest first. */
    public List<ModeTransition> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /** Id of the approval a fired rule is waiting on, if any. */
    public Optional<String> pendingApproval() {
        return Optional.ofNullable(pendingApprovalId);
    }

    /**
     * Waits until everything queued on the actor so far has been processed.
     */
    void awaitIdle() throws InterruptedException, ExecutionException {
        actor.submit(() -> { }).get();
    }

    // ── Actor-side processing ─────────────────────────────────────────────

    void processSample(MetricSample sample) {
        sample.readings().forEach((metric, value) -> observe(metric, value, sample.timestamp()));
        window = window.append(sample);
        evaluate();
    }

    void drainSignals() {
        ControlSignal signal;
        boolean any = false;
        while ((signal = signals.poll()) != null) {
            log.debug("Consuming signal {} {}={}", signal.name(), signal.metric(), signal.value());
            observe(signal.metric(), signal.value(), signal.timestamp());
            any = true;
        }
        if (any) {
            evaluate();
        }
    }

    void tick() {
        evaluate();
    }

    /**
     * One evaluation pass over the active mode's outgoing rules in priority order.
     * At most one rule is applied per pass.
     */
    void evaluate() {
        if (pending != null) {
            return;
        }
        Instant now = clock.instant();
        ModeSnapshot current = snapshot.get();
        for (TransitionRule rule : policy.rulesFrom(current.mode())) {
            RuleTracker tracker = trackers.computeIfAbsent(rule.name(), k -> new RuleTracker(rule));
            Optional<RuleTracker.Trigger> fired = tracker.update(now, condition -> valueOf(condition, now));
            if (fired.isEmpty()) {
                continue;
            }
            try {
                checkReachable(current.mode(), rule);
            } catch (ModeTransitionException e) {
                log.warn("Skipping rule {}: {}", rule.name(), e.getMessage());
                tracker.reset();
                continue;
            }
            if (rule.requiresApproval()) {
                requestApproval(rule, fired.get(), now);
            } else {
                apply(rule, fired.get(), now);
            }
            return;
        }
    }

    private void observe(String metric, double value, Instant timestamp) {
        Observation previous = observations.get(metric);
        if (previous == null || !timestamp.isBefore(previous.timestamp())) {
            observations.put(metric, new Observation(value, timestamp));
        }
    }

    private OptionalDouble valueOf(Condition condition, Instant now) {
        if (condition.isWindowed()) {
            return window.newerThan(now.minus(condition.window())).sum(condition.metric());
        }
        Observation observation = observations.get(condition.metric());
        if (observation == null) {
            return OptionalDouble.empty();
        }
        Duration age = Duration.between(observation.timestamp(), now);
        if (age.compareTo(config.getStaleAfter()) > 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(observation.value());
    }

    private void checkReachable(Mode from, TransitionRule rule) {
        if (!policy.mode(from).reachableModes().contains(rule.target())) {
            throw new ModeTransitionException(from, rule.target(),
                    rule.target() + " is not reachable from " + from);
        }
    }

    private void requestApproval(TransitionRule rule, RuleTracker.Trigger trigger, Instant now) {
        String subject = rule.source() + " -> " + rule.target();
        String reason = "rule " + rule.name() + " fired on " + trigger.metric() + "=" + trigger.value();
        PendingApproval approval = approvals.request(
                new ApprovalRequest(ApprovalRequest.Kind.MODE_TRANSITION, null, subject, reason, now),
                policy.approvalTimeout());
        pending = new PendingTransition(approval.id(), rule, trigger);
        pendingApprovalId = approval.id();
        log.info("Transition {} awaiting approval {}", subject, approval.id());
        approval.decision().whenComplete((approved, error) ->
                enqueue(() -> resolve(approval.id(), error == null && Boolean.TRUE.equals(approved))));
    }

    void resolve(String approvalId, boolean approved) {
        PendingTransition transition = pending;
        if (transition == null || !transition.approvalId().equals(approvalId)) {
            return;
        }
        pending = null;
        pendingApprovalId = null;
        TransitionRule rule = transition.rule();
        if (!approved) {
            log.info("Transition {} -> {} not approved; staying in {}",
                    rule.source(), rule.target(), current().mode());
            RuleTracker tracker = trackers.get(rule.name());
            if (tracker != null) {
                tracker.reset();
            }
            return;
        }
        if (current().mode() != rule.source()) {
            log.warn("Approved transition {} no longer applies in {}", rule.name(), current().mode());
            return;
        }
        apply(rule, transition.trigger(), clock.instant());
    }

    private void apply(TransitionRule rule, RuleTracker.Trigger trigger, Instant now) {
        ModeSnapshot previous = snapshot.get();
        Mode target = rule.target();
        ModeSnapshot next = new ModeSnapshot(target, ConstraintSet.derive(target, policy),
                now, previous.version() + 1, rule.name());
        snapshot.set(next);
        trackers.clear();

        var transition = new ModeTransition(previous.mode(), target, rule.name(),
                trigger.metric(), trigger.value(), now);
        synchronized (history) {
            history.addLast(transition);
            while (history.size() > config.getHistorySize()) {
                history.removeFirst();
            }
        }

        log.info("Mode {} -> {} (rule {}, {}={})",
                previous.mode(), target, rule.name(), trigger.metric(), trigger.value());
        metrics.recordModeTransition(previous.mode().name(), target.name(), target.ordinal());
        eventBus.publish(new HomeostatEvent(HomeostatEvent.MODE_TRANSITION, null,
                Map.of("old_mode", previous.mode().name(),
                        "new_mode", target.name(),
                        "rule", rule.name(),
                        "trigger_metric", trigger.metric(),
                        "trigger_value", trigger.value(),
                        "timestamp", now.toString()),
                now));
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Mode evaluation tick failed: {}", e.getMessage(), e);
        }
    }

    private void enqueue(Runnable work) {
        actor.execute(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Mode controller failed processing input: {}", e.getMessage(), e);
            }
        });
    }
}
