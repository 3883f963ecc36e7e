package com.homeostat.core.sensor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Emitted by the sampler when a reading crosses one of the active mode's thresholds.
 */
public record ControlSignal(
        String name,
        String metric,
        double value,
        Instant timestamp
) implements Serializable {

    public static final String EXCEEDED = "threshold_exceeded";
    public static final String RECOVERED = "threshold_recovered";

    public static ControlSignal exceeded(String metric, double value, Instant timestamp) {
        return new ControlSignal(EXCEEDED, metric, value, timestamp);
    }

    public static ControlSignal recovered(String metric, double value, Instant timestamp) {
        return new ControlSignal(RECOVERED, metric, value, timestamp);
    }
}
