package com.homeostat.core.sensor;

/**
 * Receives samples and signals from the sampler. Implementations must not block.
 */
public interface MetricSink {

    void onSample(MetricSample sample);

    void onSignal(ControlSignal signal);
}
