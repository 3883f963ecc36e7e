package com.homeostat.core.sensor;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Bounded, time-ordered run of samples.
 * <p>
 * Every instance is immutable; {@link #append} returns a new window with the oldest
 * sample evicted once {@code capacity} is exceeded. The sampler publishes each new
 * window atomically, so readers never block the writer.
 */
public record MetricWindow(
        int capacity,
        List<MetricSample> samples
) implements Serializable {

    public MetricWindow {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive, got " + capacity);
        }
        samples = samples == null ? List.of() : List.copyOf(samples);
        if (samples.size() > capacity) {
            samples = samples.subList(samples.size() - capacity, samples.size());
        }
    }

    public static MetricWindow empty(int capacity) {
        return new MetricWindow(capacity, List.of());
    }

    public MetricWindow append(MetricSample sample) {
        var next = new ArrayList<MetricSample>(Math.min(samples.size() + 1, capacity));
        int skip = samples.size() + 1 > capacity ? samples.size() + 1 - capacity : 0;
        for (int i = skip; i < samples.size(); i++) {
            next.add(samples.get(i));
        }
        next.add(sample);
        return new MetricWindow(capacity, next);
    }

    /**
     * Samples strictly newer than {@code cutoff}, same capacity.
     */
    public MetricWindow newerThan(Instant cutoff) {
        return new MetricWindow(capacity, samples.stream()
                .filter(s -> s.timestamp().isAfter(cutoff))
                .toList());
    }

    /**
     * Samples in {@code [from, to]}, inclusive at both ends.
     */
    public MetricWindow between(Instant from, Instant to) {
        return new MetricWindow(capacity, samples.stream()
                .filter(s -> !s.timestamp().isBefore(from) && !s.timestamp().isAfter(to))
                .toList());
    }

    public Optional<MetricSample> latest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    public int size() {
        return samples.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /** Present values of {@code metric}, oldest first. */
    public List<Double> values(String metric) {
        return samples.stream()
                .map(s -> s.readings().get(metric))
                .filter(v -> v != null)
                .toList();
    }

    public OptionalDouble sum(String metric) {
        var values = values(metric);
        return values.isEmpty()
                ? OptionalDouble.empty()
                : OptionalDouble.of(values.stream().mapToDouble(Double::doubleValue).sum());
    }

    public OptionalDouble average(String metric) {
        return values(metric).stream().mapToDouble(Double::doubleValue).average();
    }

    public OptionalDouble max(String metric) {
        return values(metric).stream().mapToDouble(Double::doubleValue).max();
    }
}
