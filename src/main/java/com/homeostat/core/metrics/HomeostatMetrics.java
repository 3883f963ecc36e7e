package com.homeostat.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for task execution and mode control.
 */
@Service
public class HomeostatMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger modeLevel = new AtomicInteger(0);
    private final AtomicInteger activeTasks = new AtomicInteger(0);

    public HomeostatMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("homeostat.mode.level", modeLevel, AtomicInteger::get)
                .description("Ordinal of the active mode (0 = NORMAL)")
                .register(registry);
        Gauge.builder("homeostat.tasks.active", activeTasks, AtomicInteger::get)
                .register(registry);
    }

    public void recordStep(String state, Duration duration) {
        Timer.builder("homeostat.step.duration")
                .tag("state", state)
                .register(registry)
                .record(duration);
    }

    public void recordTaskResult(String status) {
        Counter.builder("homeostat.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(Duration duration) {
        Timer.builder("homeostat.task.duration")
                .register(registry)
                .record(duration);
    }

    public void recordDecision(String verdict, String category) {
        Counter.builder("homeostat.governance.decisions")
                .tag("verdict", verdict)
                .tag("category", category)
                .register(registry)
                .increment();
    }

    /**
     * Records an applied mode change and updates the mode gauge.
     *
     * @param from  previous mode name
     * @param to    new mode name
     * @param level ordinal of the new mode
     */
    public void recordModeTransition(String from, String to, int level) {
        Counter.builder("homeostat.mode.transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
        modeLevel.set(level);
    }

    public void recordCollectorFailure(String metric, String reason) {
        Counter.builder("homeostat.sampler.collector_failures")
                .description("Collector readings omitted from a sample")
                .tag("metric", metric)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSampleSize(int readings) {
        DistributionSummary.builder("homeostat.sampler.readings")
                .description("Readings per sample")
                .register(registry)
                .record(readings);
    }

    public void recordApproval(String outcome) {
        Counter.builder("homeostat.approvals.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void taskStarted() {
        activeTasks.incrementAndGet();
    }

    public void taskFinished() {
        activeTasks.decrementAndGet();
    }
}
