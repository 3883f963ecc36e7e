package com.homeostat.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HomeostatMetricsTest {

    private SimpleMeterRegistry registry;
    private HomeostatMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HomeostatMetrics(registry);
    }

    @Test
    @DisplayName("recordStep creates a timer per state")
    void recordStep() {
        metrics.recordStep("MODEL_CALL", Duration.ofMillis(120));
        metrics.recordStep("MODEL_CALL", Duration.ofMillis(80));
        metrics.recordStep("INIT", Duration.ofMillis(1));

        var timer = registry.find("homeostat.step.duration").tag("state", "MODEL_CALL").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordTaskResult counts by status")
    void recordTaskResult() {
        metrics.recordTaskResult("COMPLETED");
        metrics.recordTaskResult("COMPLETED");
        metrics.recordTaskResult("FAILED");

        assertEquals(2.0, registry.find("homeostat.tasks.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("homeostat.tasks.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("recordModeTransition counts the edge and moves the mode gauge")
    void recordModeTransition() {
        assertEquals(0.0, registry.find("homeostat.mode.level").gauge().value());

        metrics.recordModeTransition("NORMAL", "ALERT", 1);

        assertEquals(1.0, registry.find("homeostat.mode.transitions")
                .tag("from", "NORMAL").tag("to", "ALERT").counter().count());
        assertEquals(1.0, registry.find("homeostat.mode.level").gauge().value());
    }

    @Test
    @DisplayName("active task gauge follows start and finish")
    void activeTasks() {
        metrics.taskStarted();
        metrics.taskStarted();
        metrics.taskFinished();

        assertEquals(1.0, registry.find("homeostat.tasks.active").gauge().value());
    }

    @Test
    @DisplayName("decision, collector and approval counters carry their tags")
    void taggedCounters() {
        metrics.recordDecision("DENIED", "system_write");
        metrics.recordCollectorFailure("cpu", "timeout");
        metrics.recordApproval("expired");
        metrics.recordSampleSize(3);

        assertNotNull(registry.find("homeostat.governance.decisions")
                .tag("verdict", "DENIED").tag("category", "system_write").counter());
        assertNotNull(registry.find("homeostat.sampler.collector_failures")
                .tag("metric", "cpu").tag("reason", "timeout").counter());
        assertNotNull(registry.find("homeostat.approvals.total").tag("outcome", "expired").counter());
        assertEquals(3.0, registry.find("homeostat.sampler.readings").summary().totalAmount());
    }
}
