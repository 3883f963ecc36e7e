package com.homeostat.core.sensor;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * System-wide CPU load in percent, from the platform OS bean.
 */
public class CpuLoadCollector implements MetricCollector {

    public static final String METRIC = "cpu_load";

    private final OperatingSystemMXBean osBean;

    public CpuLoadCollector() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    CpuLoadCollector(OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public String metric() {
        return METRIC;
    }

    @Override
    public double collect() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean platform) {
            double load = platform.getCpuLoad();
            if (load < 0) {
                throw new CollectionException("CPU load not yet available");
            }
            return load * 100.0;
        }
        // Fallback: load average normalised by processor count
        double average = osBean.getSystemLoadAverage();
        if (average < 0) {
            throw new CollectionException("CPU load not supported on this platform");
        }
        return Math.min(100.0, average / osBean.getAvailableProcessors() * 100.0);
    }
}
