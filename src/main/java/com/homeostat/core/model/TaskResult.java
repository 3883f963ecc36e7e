package com.homeostat.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * What a requester gets back for a task. Failures carry only a generic summary;
 * the structured error stays in telemetry, correlated by {@code traceId}.
 */
public record TaskResult(
        String traceId,
        TaskState state,
        String reply,
        String errorSummary,
        List<StepRecord> steps,
        MetricsSummary metricsSummary
) implements Serializable {

    public TaskResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public boolean succeeded() {
        return state == TaskState.COMPLETED;
    }
}
