package com.homeostat.core.trace;

import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.StepRecord;
import com.homeostat.core.model.TaskState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextTest {

    @Test
    void sequenceStartsAtOneWithoutGaps() {
        TraceContext trace = TraceContext.start();

        assertEquals(0, trace.currentSequence());
        assertEquals(1, trace.nextSequence());
        assertEquals(2, trace.nextSequence());
        assertEquals(2, trace.currentSequence());
    }

    @Test
    void traceIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(TraceContext.newTraceId());
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void resumeContinuesAfterRecordedSteps() {
        Instant now = Instant.now();
        ExecutionContext context = ExecutionContext.start("t-1", null, "hi", now)
                .withStep(new StepRecord(1, TaskState.INIT, TaskState.MODEL_CALL, now, now, Duration.ZERO, 1))
                .withStep(new StepRecord(2, TaskState.MODEL_CALL, TaskState.SYNTHESIS, now, now, Duration.ZERO, 1));

        TraceContext trace = TraceContext.resume(context);

        assertEquals("t-1", trace.traceId());
        assertEquals(3, trace.nextSequence());
    }

    @Test
    void concurrentReservationsNeverCollide() {
        TraceContext trace = TraceContext.start();
        Set<Long> seen = ConcurrentHashMap.newKeySet();

        IntStream.range(0, 500).parallel().forEach(i -> seen.add(trace.nextSequence()));

        assertEquals(500, seen.size());
        assertEquals(500, trace.currentSequence());
    }
}
