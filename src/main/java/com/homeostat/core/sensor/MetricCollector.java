package com.homeostat.core.sensor;

/**
 * Produces one named reading per sampling cycle.
 */
public interface MetricCollector {

    String metric();

    /**
     * @throws CollectionException if the reading is unavailable this cycle
     */
    double collect();
}
