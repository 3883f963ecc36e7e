package com.homeostat.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Audit entry for one state transition of a task.
 * <p>
 * {@code sequence} is the ordering source of truth within a trace; timestamps are
 * informational only.
 */
public record StepRecord(
        long sequence,
        TaskState fromState,
        TaskState toState,
        Instant startedAt,
        Instant endedAt,
        Duration duration,
        int attempts
) implements Serializable {

    public StepRecord(long sequence, TaskState fromState, TaskState toState, Instant startedAt, Instant endedAt) {
        this(sequence, fromState, toState, startedAt, endedAt, Duration.between(startedAt, endedAt), 1);
    }

    public long durationMs() {
        return duration.toMillis();
    }
}
