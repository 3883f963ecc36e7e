package com.homeostat.core.sensor;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Physical memory in use, in percent of total.
 */
public class MemoryUsedCollector implements MetricCollector {

    public static final String METRIC = "memory_used";

    private final OperatingSystemMXBean osBean;

    public MemoryUsedCollector() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    MemoryUsedCollector(OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public String metric() {
        return METRIC;
    }

    @Override
    public double collect() {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean platform)) {
            throw new CollectionException("Physical memory size not exposed by this JVM");
        }
        long total = platform.getTotalMemorySize();
        if (total <= 0) {
            throw new CollectionException("Total memory size reported as " + total);
        }
        long free = platform.getFreeMemorySize();
        return (double) (total - free) / total * 100.0;
    }
}
