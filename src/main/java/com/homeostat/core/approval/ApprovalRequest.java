package com.homeostat.core.approval;

import java.io.Serializable;
import java.time.Instant;

/**
 * Something waiting for an operator's decision.
 *
 * @param traceId task correlation id; {@code null} for mode transitions
 * @param subject what is being approved, e.g. a tool name or {@code ALERT -> LOCKDOWN}
 */
public record ApprovalRequest(
        Kind kind,
        String traceId,
        String subject,
        String reason,
        Instant requestedAt
) implements Serializable {

    public enum Kind {
        CAPABILITY,
        MODE_TRANSITION
    }
}
