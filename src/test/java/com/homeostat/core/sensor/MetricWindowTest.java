package com.homeostat.core.sensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricWindowTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static MetricSample at(int seconds, Map<String, Double> readings) {
        return MetricSample.system(T0.plusSeconds(seconds), readings);
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("evicts the oldest sample once capacity is exceeded")
        void evictsOldest() {
            MetricWindow window = MetricWindow.empty(2)
                    .append(at(0, Map.of("cpu_load", 1.0)))
                    .append(at(1, Map.of("cpu_load", 2.0)))
                    .append(at(2, Map.of("cpu_load", 3.0)));

            assertEquals(2, window.size());
            assertEquals(List.of(2.0, 3.0), window.values("cpu_load"));
        }

        @Test
        @DisplayName("leaves the original window untouched")
        void isImmutable() {
            MetricWindow empty = MetricWindow.empty(3);
            MetricWindow one = empty.append(at(0, Map.of("cpu_load", 1.0)));

            assertTrue(empty.isEmpty());
            assertEquals(1, one.size());
        }

        @Test
        @DisplayName("rejects a non-positive capacity")
        void rejectsZeroCapacity() {
            assertThrows(IllegalArgumentException.class, () -> MetricWindow.empty(0));
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        private final MetricWindow window = MetricWindow.empty(10)
                .append(at(0, Map.of("cpu_load", 10.0, "memory_used", 50.0)))
                .append(at(10, Map.of("cpu_load", 30.0)))
                .append(at(20, Map.of("cpu_load", 20.0, "memory_used", 70.0)));

        @Test
        @DisplayName("aggregates only samples that carry the metric")
        void aggregatesPresentValues() {
            assertEquals(60.0, window.sum("cpu_load").getAsDouble());
            assertEquals(20.0, window.average("cpu_load").getAsDouble());
            assertEquals(30.0, window.max("cpu_load").getAsDouble());
            assertEquals(60.0, window.average("memory_used").getAsDouble());
        }

        @Test
        @DisplayName("missing metric yields empty aggregates, not zero")
        void missingMetricIsEmpty() {
            assertTrue(window.sum("disk_used").isEmpty());
            assertTrue(window.average("disk_used").isEmpty());
        }

        @Test
        @DisplayName("between is inclusive at both ends")
        void betweenIsInclusive() {
            MetricWindow slice = window.between(T0.plusSeconds(10), T0.plusSeconds(20));
            assertEquals(2, slice.size());
        }

        @Test
        @DisplayName("newerThan excludes the cutoff itself")
        void newerThanIsExclusive() {
            MetricWindow recent = window.newerThan(T0.plus(Duration.ofSeconds(10)));
            assertEquals(1, recent.size());
            assertEquals(T0.plusSeconds(20), recent.latest().orElseThrow().timestamp());
        }

        @Test
        @DisplayName("latest is empty for an empty window")
        void latestOfEmpty() {
            assertTrue(MetricWindow.empty(1).latest().isEmpty());
        }
    }
}
