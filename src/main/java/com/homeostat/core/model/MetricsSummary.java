package com.homeostat.core.model;

import java.io.Serializable;

/**
 * Resource readings observed while a task was running. Averages and maxima are
 * {@code null} when no sample carried the metric.
 */
public record MetricsSummary(
        int sampleCount,
        Double cpuAvg,
        Double cpuMax,
        Double memoryAvg,
        Double memoryMax,
        int thresholdCrossings
) implements Serializable {

    public static MetricsSummary empty() {
        return new MetricsSummary(0, null, null, null, null, 0);
    }
}
