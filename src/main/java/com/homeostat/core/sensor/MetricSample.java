package com.homeostat.core.sensor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One point-in-time set of readings. Metrics whose collector failed are absent,
 * never zero-filled.
 */
public record MetricSample(
        Instant timestamp,
        String kind,
        int schemaVersion,
        Map<String, Double> readings
) implements Serializable {

    public static final String KIND_SYSTEM = "system";
    public static final int SCHEMA_VERSION = 1;

    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp");
        readings = readings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(readings));
    }

    public static MetricSample system(Instant timestamp, Map<String, Double> readings) {
        return new MetricSample(timestamp, KIND_SYSTEM, SCHEMA_VERSION, readings);
    }

    public Optional<Double> value(String metric) {
        return Optional.ofNullable(readings.get(metric));
    }

    public boolean has(String metric) {
        return readings.containsKey(metric);
    }
}
