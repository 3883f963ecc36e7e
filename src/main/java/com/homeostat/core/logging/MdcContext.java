package com.homeostat.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Homeostat-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TRACE_ID = "traceId";
    public static final String STEP_SEQ = "stepSeq";
    public static final String TASK_STATE = "taskState";

    private MdcContext() {}

    public static void setTrace(String traceId) {
        MDC.put(TRACE_ID, traceId);
    }

    public static void setStep(String traceId, long sequence, String state) {
        MDC.put(TRACE_ID, traceId);
        MDC.put(STEP_SEQ, String.valueOf(sequence));
        MDC.put(TASK_STATE, state);
    }

    public static void clearStep() {
        MDC.remove(STEP_SEQ);
        MDC.remove(TASK_STATE);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(STEP_SEQ);
        MDC.remove(TASK_STATE);
    }
}
