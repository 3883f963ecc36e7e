package com.homeostat.core.engine;

import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.governance.Decision;
import com.homeostat.core.governance.DeniedException;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.logging.MdcContext;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.MetricsSummary;
import com.homeostat.core.model.TaskError;
import com.homeostat.core.model.TaskResult;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.sensor.ControlSignal;
import com.homeostat.core.sensor.CpuLoadCollector;
import com.homeostat.core.sensor.MemoryUsedCollector;
import com.homeostat.core.sensor.MetricSampler;
import com.homeostat.core.sensor.MetricWindow;
import com.homeostat.core.trace.TraceContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for requests: admits each one against the concurrency ceiling, runs it
 * on the task pool and turns the final context into a {@link TaskResult}.
 * <p>
 * Results never carry raw error details; a failed task gets a generic summary and its
 * trace id.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskExecutor executor;
    private final GovernanceGate gate;
    private final ModeView modeView;
    private final MetricSampler sampler;
    private final EventBus eventBus;
    private final HomeostatMetrics metrics;
    private final Clock clock;

    private final AtomicInteger workerThreads = new AtomicInteger();
    private final ExecutorService taskPool;

    public TaskService(TaskExecutor executor, GovernanceGate gate, ModeView modeView, MetricSampler sampler,
                       EventBus eventBus, HomeostatMetrics metrics, Clock clock, HomeostatProperties properties) {
        this.executor = executor;
        this.gate = gate;
        this.modeView = modeView;
        this.sampler = sampler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.taskPool = Executors.newFixedThreadPool(properties.getExecutor().getPoolSize(), r -> {
            Thread t = new Thread(r, "task-worker-" + workerThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        taskPool.shutdownNow();
    }

    /**
     * Queues a request on the task pool.
     *
     * @param sessionId conversation to continue, or {@code null} for a one-off request
     */
    public CompletableFuture<TaskResult> submit(String sessionId, String message) {
        String traceId = TraceContext.newTraceId();
        return CompletableFuture.supplyAsync(() -> run(traceId, sessionId, message), taskPool);
    }

    /**
     * Runs a request on the calling thread.
     */
    public TaskResult run(String sessionId, String message) {
        return run(TraceContext.newTraceId(), sessionId, message);
    }

    TaskResult run(String traceId, String sessionId, String message) {
        Instant startedAt = clock.instant();
        ExecutionContext context = ExecutionContext.start(traceId, sessionId, message, startedAt);
        MdcContext.setTrace(traceId);
        metrics.taskStarted();
        try {
            log.info("Task {} started in mode {}", traceId, modeView.current().mode());
            eventBus.publish(new HomeostatEvent(HomeostatEvent.TASK_STARTED, traceId,
                    Map.of("session_id", sessionId != null ? sessionId : "",
                            "mode", modeView.current().mode().name()),
                    startedAt));

            Decision slot = gate.check(Capability.concurrencySlot(), context);
            ExecutionContext result;
            if (slot.isAllowed()) {
                try {
                    result = executor.execute(context);
                } finally {
                    gate.releaseSlot();
                }
            } else {
                result = reject(context, slot);
            }
            return finish(result, startedAt);
        } catch (RuntimeException e) {
            log.error("Task {} failed outside the executor: {}", traceId, e.getMessage(), e);
            return finish(context.failed(TaskError.of(e, context.state())), startedAt);
        } finally {
            metrics.taskFinished();
            MdcContext.clear();
        }
    }

    private ExecutionContext reject(ExecutionContext context, Decision slot) {
        var denied = new DeniedException(Capability.concurrencySlot().describe(), slot.reason());
        log.info("Task {} not admitted: {}", context.traceId(), slot.reason());
        eventBus.publish(new HomeostatEvent(HomeostatEvent.POLICY_VIOLATION, context.traceId(),
                Map.of("capability", denied.capability(),
                        "state", context.state().name(),
                        "mode", modeView.current().mode().name(),
                        "reason", denied.getMessage()),
                clock.instant()));
        return context.failed(TaskError.of(denied, context.state()));
    }

    private TaskResult finish(ExecutionContext context, Instant startedAt) {
        Instant endedAt = clock.instant();
        MetricsSummary summary = summarize(startedAt, endedAt);
        ExecutionContext done = context.toBuilder().metricsSummary(summary).build();

        metrics.recordTaskResult(done.state().name());
        metrics.recordTaskDuration(Duration.between(startedAt, endedAt));

        var payload = new LinkedHashMap<String, Object>();
        payload.put("state", done.state().name());
        payload.put("steps", done.steps().size());
        payload.put("duration_ms", Duration.between(startedAt, endedAt).toMillis());
        if (done.error() != null) {
            payload.put("error_type", done.error().type());
            payload.put("error_state", done.error().state().name());
            payload.put("error_message", String.valueOf(done.error().message()));
        }
        String eventType = done.state() == TaskState.COMPLETED ? HomeostatEvent.TASK_COMPLETED : HomeostatEvent.TASK_FAILED;
        eventBus.publish(new HomeostatEvent(eventType, done.traceId(), payload, endedAt));

        String errorSummary = done.state() == TaskState.FAILED
                ? ErrorSummaries.summarize(done.error(), done.traceId())
                : null;
        return new TaskResult(done.traceId(), done.state(), done.reply(), errorSummary, done.steps(), summary);
    }

    /**
     * Resource readings sampled while the task ran.
     */
    MetricsSummary summarize(Instant from, Instant to) {
        MetricWindow window = sampler.snapshot().between(from, to);
        int crossings = (int) sampler.signalsSince(from).stream()
                .map(ControlSignal::timestamp)
                .filter(t -> !t.isAfter(to))
                .count();
        return new MetricsSummary(window.size(),
                boxed(window.average(CpuLoadCollector.METRIC)),
                boxed(window.max(CpuLoadCollector.METRIC)),
                boxed(window.average(MemoryUsedCollector.METRIC)),
                boxed(window.max(MemoryUsedCollector.METRIC)),
                crossings);
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
