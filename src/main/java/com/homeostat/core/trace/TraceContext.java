package com.homeostat.core.trace;

import com.homeostat.core.model.ExecutionContext;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation id and step sequence for one task.
 * <p>
 * Sequence numbers start at 1 and are handed out without gaps; a context resumed from an
 * earlier run continues after its last recorded step.
 */
public final class TraceContext {

    private final String traceId;
    private final AtomicLong sequence;

    private TraceContext(String traceId, long lastSequence) {
        this.traceId = traceId;
        this.sequence = new AtomicLong(lastSequence);
    }

    public static TraceContext start() {
        return new TraceContext(newTraceId(), 0);
    }

    /** Continues the trace of {@code context}, numbering after its recorded steps. */
    public static TraceContext resume(ExecutionContext context) {
        return new TraceContext(context.traceId(), context.steps().size());
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    public String traceId() {
        return traceId;
    }

    /** Reserves the next step sequence number. */
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    /** Last sequence number handed out, 0 before the first step. */
    public long currentSequence() {
        return sequence.get();
    }
}
