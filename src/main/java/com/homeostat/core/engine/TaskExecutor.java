package com.homeostat.core.engine;

import com.homeostat.core.approval.ApprovalRequest;
import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.approval.ApprovalTimeoutException;
import com.homeostat.core.approval.PendingApproval;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.governance.Decision;
import com.homeostat.core.governance.DeniedException;
import com.homeostat.core.governance.EffectiveLimits;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.logging.MdcContext;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.StepRecord;
import com.homeostat.core.model.TaskError;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.trace.TraceContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one task's state machine from its current state to {@code COMPLETED} or
 * {@code FAILED}.
 * <p>
 * Before each step the capabilities the step will use are checked with the
 * {@link GovernanceGate}; a denial fails the task without running the handler, and an
 * approval requirement blocks this task (only) until an operator decides. Handlers run
 * on a separate step pool so their timeout can interrupt them. Every step, including a
 * failing one, is recorded with the next sequence number of the task's
 * {@link TraceContext}. Nothing thrown by a handler escapes {@link #execute}.
 */
@Service("homeostatTaskExecutor")
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final Map<TaskState, StepHandler> handlers;
    private final GovernanceGate gate;
    private final ModeView modeView;
    private final ApprovalService approvals;
    private final GovernancePolicy policy;
    private final EventBus eventBus;
    private final HomeostatMetrics metrics;
    private final Clock clock;
    private final HomeostatProperties.Executor config;

    private final AtomicInteger stepThreads = new AtomicInteger();
    private final ExecutorService stepPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "task-step-" + stepThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public TaskExecutor(List<StepHandler> handlers, GovernanceGate gate, ModeView modeView,
                        ApprovalService approvals, GovernancePolicy policy, EventBus eventBus,
                        HomeostatMetrics metrics, Clock clock, HomeostatProperties properties) {
        this.handlers = index(handlers);
        this.gate = gate;
        this.modeView = modeView;
        this.approvals = approvals;
        this.policy = policy;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getExecutor();
    }

    @PreDestroy
    void shutdown() {
        stepPool.shutdownNow();
    }

    /**
     * Runs {@code context} until it reaches a terminal state. A context that is already
     * terminal is returned as is.
     */
    public ExecutionContext execute(ExecutionContext context) {
        if (context.isTerminal()) {
            log.debug("Task {} already {}; nothing to do", context.traceId(), context.state());
            return context;
        }
        TraceContext trace = TraceContext.resume(context);
        long budgetDeadline = System.nanoTime() + config.getTaskBudget().toNanos();

        MdcContext.setTrace(trace.traceId());
        try {
            ExecutionContext current = context;
            while (!current.isTerminal()) {
                current = step(current, trace, budgetDeadline);
            }
            log.info("Task {} finished {} after {} steps", trace.traceId(), current.state(), current.steps().size());
            return current;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs exactly one step of a non-terminal context.
     */
    ExecutionContext step(ExecutionContext context, TraceContext trace, long budgetDeadline) {
        TaskState state = context.state();
        StepHandler handler = handlers.get(state);

        List<Capability> capabilities;
        try {
            capabilities = handler.capabilities(context);
            admit(capabilities, context, budgetDeadline);
        } catch (DeniedException e) {
            violation(context, e);
            return fail(context, trace, state, e, 0);
        } catch (ApprovalTimeoutException | StepTimeoutException e) {
            return fail(context, trace, state, e, 0);
        } catch (RuntimeException e) {
            return fail(context, trace, state, new StepExecutionException(state, e), 0);
        }

        long remainingBudget = budgetDeadline - System.nanoTime();
        if (remainingBudget <= 0) {
            return fail(context, trace, state, budgetExhausted(state, "before"), 0);
        }
        Duration timeout = stepTimeout(capabilities, Duration.ofNanos(remainingBudget));

        long sequence = trace.nextSequence();
        MdcContext.setStep(trace.traceId(), sequence, state.name());
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        try {
            Attempt attempt = invoke(handler, context, timeout);
            Instant endedAt = clock.instant();
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            if (attempt.failure() != null) {
                return record(context, trace, sequence, state, TaskState.FAILED, startedAt, endedAt, duration,
                        attempt.attempts(), attempt.failure());
            }
            StepOutcome outcome = attempt.outcome();
            ExecutionContext adopted = outcome.context().toBuilder()
                    .state(outcome.next())
                    .steps(context.steps())
                    .build();
            return record(adopted, trace, sequence, state, outcome.next(), startedAt, endedAt, duration,
                    attempt.attempts(), null);
        } finally {
            MdcContext.clearStep();
        }
    }

    // ── Governance ────────────────────────────────────────────────────

    private void admit(List<Capability> capabilities, ExecutionContext context, long budgetDeadline) {
        for (Capability capability : capabilities) {
            Decision decision = gate.check(capability, context);
            if (decision.requiresApproval()) {
                decision = awaitApproval(capability, decision, context, budgetDeadline);
            }
            if (decision.isDenied()) {
                throw new DeniedException(capability.describe(), decision.reason());
            }
        }
    }

    /**
     * Blocks until the operator decides, the approval expires, or the task budget runs out,
     * whichever comes first. Running out of budget withdraws the request.
     */
    private Decision awaitApproval(Capability capability, Decision decision, ExecutionContext context,
                                   long budgetDeadline) {
        Duration timeout = policy.approvalTimeout();
        long remainingBudget = budgetDeadline - System.nanoTime();
        if (remainingBudget <= 0) {
            throw budgetExhausted(context.state(), "before approval of " + capability.describe() + " in");
        }
        boolean budgetBound = remainingBudget < timeout.toNanos();
        PendingApproval approval = approvals.request(new ApprovalRequest(ApprovalRequest.Kind.CAPABILITY,
                context.traceId(), capability.describe(), decision.reason(), clock.instant()), timeout);
        log.info("Task {} suspended in {} awaiting approval {}", context.traceId(), context.state(), approval.id());

        boolean approved;
        try {
            approved = budgetBound
                    ? approval.decision().get(remainingBudget, TimeUnit.NANOSECONDS)
                    : approval.decision().get();
        } catch (TimeoutException e) {
            approvals.cancel(approval.id());
            log.warn("Task {} ran out of budget awaiting approval {}; request withdrawn",
                    context.traceId(), approval.id());
            throw budgetExhausted(context.state(), "awaiting approval " + approval.id() + " in");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new ApprovalTimeoutException("Approval " + approval.id() + " for " + capability.describe()
                        + " timed out after " + timeout.toSeconds() + "s");
            }
            throw new DeniedException(capability.describe(), "approval " + approval.id() + " was cancelled");
        } catch (CancellationException e) {
            throw new DeniedException(capability.describe(), "approval " + approval.id() + " was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeniedException(capability.describe(), "interrupted while awaiting approval " + approval.id());
        }
        if (!approved) {
            throw new DeniedException(capability.describe(), "approval " + approval.id() + " rejected by operator");
        }
        log.info("Task {} resuming in {} after approval {}", context.traceId(), context.state(), approval.id());
        return gate.admitApproved(capability, context);
    }

    private StepTimeoutException budgetExhausted(TaskState state, String when) {
        return new StepTimeoutException(state,
                "Task budget of " + config.getTaskBudget().toMillis() + "ms exhausted " + when + " " + state);
    }

    private Duration stepTimeout(List<Capability> capabilities, Duration remainingBudget) {
        Duration timeout = modeView.current().constraints().stepTimeout();
        for (Capability capability : capabilities) {
            EffectiveLimits limits = gate.limitsFor(capability);
            if (limits.timeout() != null && limits.timeout().compareTo(timeout) < 0) {
                timeout = limits.timeout();
            }
        }
        return remainingBudget.compareTo(timeout) < 0 ? remainingBudget : timeout;
    }

    private void violation(ExecutionContext context, DeniedException e) {
        eventBus.publish(new HomeostatEvent(HomeostatEvent.POLICY_VIOLATION, context.traceId(),
                Map.of("capability", e.capability(),
                        "state", context.state().name(),
                        "mode", modeView.current().mode().name(),
                        "reason", e.getMessage()),
                clock.instant()));
    }

    // ── Handler invocation ────────────────────────────────────────────

    private record Attempt(StepOutcome outcome, RuntimeException failure, int attempts) {}

    private Attempt invoke(StepHandler handler, ExecutionContext context, Duration timeout) {
        TaskState state = handler.state();
        RetryPolicy retry = handler.retryPolicy();
        long deadline = System.nanoTime() + timeout.toNanos();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        int attempts = 0;

        while (true) {
            attempts++;
            Future<StepOutcome> future = stepPool.submit(() -> runWithMdc(handler, context, mdc));
            try {
                StepOutcome outcome = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (outcome == null) {
                    return new Attempt(null, new StepExecutionException(state, "handler returned no outcome"), attempts);
                }
                if (!context.traceId().equals(outcome.context().traceId())) {
                    return new Attempt(null, new StepExecutionException(state, "handler switched trace id"), attempts);
                }
                return new Attempt(outcome, null, attempts);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Step {} timed out after {}ms; cancelled", state, timeout.toMillis());
                return new Attempt(null, new StepTimeoutException(state, timeout), attempts);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                long backoff = config.getRetryBackoff().toNanos();
                boolean retryable = retry.isRetryable(cause)
                        && attempts < config.getRetryAttempts()
                        && deadline - System.nanoTime() > backoff;
                if (!retryable) {
                    log.warn("Step {} failed after {} attempt(s): {}", state, attempts, cause.getMessage());
                    return new Attempt(null, new StepExecutionException(state, cause), attempts);
                }
                log.info("Step {} attempt {} failed transiently ({}); retrying in {}ms",
                        state, attempts, cause.getMessage(), config.getRetryBackoff().toMillis());
                if (!sleep(backoff)) {
                    return new Attempt(null, new StepExecutionException(state, cause), attempts);
                }
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return new Attempt(null, new StepExecutionException(state, e), attempts);
            }
        }
    }

    private static StepOutcome runWithMdc(StepHandler handler, ExecutionContext context, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return handler.handle(context);
        } finally {
            MDC.clear();
        }
    }

    private static boolean sleep(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── Recording ─────────────────────────────────────────────────────

    private ExecutionContext fail(ExecutionContext context, TraceContext trace, TaskState state,
                                  RuntimeException error, int attempts) {
        long sequence = trace.nextSequence();
        Instant now = clock.instant();
        return record(context, trace, sequence, state, TaskState.FAILED, now, now, Duration.ZERO, attempts, error);
    }

    private ExecutionContext record(ExecutionContext context, TraceContext trace, long sequence,
                                    TaskState from, TaskState to, Instant startedAt, Instant endedAt,
                                    Duration duration, int attempts, RuntimeException error) {
        var step = new StepRecord(sequence, from, to, startedAt, endedAt, duration, attempts);
        ExecutionContext next = context.withStep(step);
        if (error != null) {
            log.warn("[{}] step {} {} -> FAILED: {}", trace.traceId(), sequence, from, error.getMessage());
            next = next.failed(TaskError.of(error, from));
        } else {
            log.info("[{}] step {} {} -> {} ({}ms)", trace.traceId(), sequence, from, to, duration.toMillis());
            next = next.withState(to);
        }
        metrics.recordStep(from.name(), duration);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("trace_id", trace.traceId());
        payload.put("sequence", sequence);
        payload.put("from_state", from.name());
        payload.put("to_state", next.state().name());
        payload.put("duration_ms", duration.toMillis());
        payload.put("attempts", attempts);
        if (error != null) {
            payload.put("error_type", error.getClass().getSimpleName());
        }
        eventBus.publish(new HomeostatEvent(HomeostatEvent.STATE_TRANSITION, trace.traceId(), payload, endedAt));
        return next;
    }

    // ── Helpers ───────────────────────────────────────────────────────

    private static Map<TaskState, StepHandler> index(List<StepHandler> handlers) {
        var byState = new EnumMap<TaskState, StepHandler>(TaskState.class);
        for (StepHandler handler : handlers) {
            if (handler.state().isTerminal()) {
                throw new IllegalStateException("Handler registered for terminal state " + handler.state());
            }
            StepHandler previous = byState.put(handler.state(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.state() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        for (TaskState state : TaskState.values()) {
            if (!state.isTerminal() && !byState.containsKey(state)) {
                throw new IllegalStateException("No handler for " + state);
            }
        }
        return byState;
    }
}
