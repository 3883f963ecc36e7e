package com.homeostat.core.policy;

import java.io.Serializable;

/**
 * Per-mode call budgets. A {@code null} budget means unlimited.
 */
public record RateLimits(
        Integer toolCallsPerMinute,
        Integer modelCallsPerMinute
) implements Serializable {

    public static RateLimits unlimited() {
        return new RateLimits(null, null);
    }
}
