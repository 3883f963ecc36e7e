package com.homeostat.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Telemetry event published on the {@link EventBus}.
 *
 * @param eventType one of the type constants below
 * @param traceId   task correlation id, or {@code null} for system-wide events
 * @param payload   event-specific fields
 * @param timestamp when the event occurred
 */
public record HomeostatEvent(
        String eventType,
        String traceId,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static final String TASK_STARTED = "task_started";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_FAILED = "task_failed";
    public static final String STATE_TRANSITION = "state_transition";
    public static final String MODE_TRANSITION = "mode_transition";
    public static final String POLICY_VIOLATION = "policy_violation";
    public static final String APPROVAL_REQUIRED = "approval_required";
    public static final String APPROVAL_GRANTED = "approval_granted";
    public static final String APPROVAL_DENIED = "approval_denied";
    public static final String CONTROL_SIGNAL = "control_signal";

    public HomeostatEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public boolean isSystemWide() {
        return traceId == null;
    }
}
