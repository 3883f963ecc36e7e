package com.homeostat.core.policy;

import java.io.Serializable;
import java.time.Duration;

/**
 * One clause of a transition rule.
 *
 * @param metric    metric name
 * @param operator  comparison against {@code threshold}
 * @param threshold value compared against
 * @param sustained how long the clause must hold continuously before it counts
 * @param window    when set, the clause compares the sum of the metric over this window
 *                  instead of the latest reading
 */
public record Condition(
        String metric,
        Operator operator,
        double threshold,
        Duration sustained,
        Duration window
) implements Serializable {

    public Condition {
        sustained = sustained == null ? Duration.ZERO : sustained;
    }

    public boolean isWindowed() {
        return window != null;
    }

    public boolean test(double value) {
        return operator.test(value, threshold);
    }

    @Override
    public String toString() {
        return metric + " " + operator.symbol() + " " + threshold
                + (isWindowed() ? " over " + window : "")
                + (sustained.isZero() ? "" : " for " + sustained);
    }
}
