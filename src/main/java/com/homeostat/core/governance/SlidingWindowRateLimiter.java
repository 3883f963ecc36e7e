package com.homeostat.core.governance;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-key sliding-window counters.
 * <p>
 * {@link #tryAcquireAll} checks every limit and records a hit against each of them in one
 * atomic step, or records nothing at all.
 */
@Component
public class SlidingWindowRateLimiter {

    /** One budget to respect: at most {@code max} hits per {@code window} on {@code key}. */
    public record Limit(String key, int max, Duration window) {}

    private final Map<String, ArrayDeque<Instant>> hits = new HashMap<>();

    public synchronized boolean tryAcquireAll(List<Limit> limits, Instant now) {
        for (Limit limit : limits) {
            if (count(limit.key(), limit.window(), now) >= limit.max()) {
                return false;
            }
        }
        for (Limit limit : limits) {
            hits.computeIfAbsent(limit.key(), k -> new ArrayDeque<>()).addLast(now);
        }
        return true;
    }

    public boolean tryAcquire(Limit limit, Instant now) {
        return tryAcquireAll(List.of(limit), now);
    }

    /** Hits on {@code key} inside the window ending at {@code now}. */
    public synchronized int usage(String key, Duration window, Instant now) {
        return count(key, window, now);
    }

    private int count(String key, Duration window, Instant now) {
        ArrayDeque<Instant> stamps = hits.get(key);
        if (stamps == null) {
            return 0;
        }
        Instant cutoff = now.minus(window);
        while (!stamps.isEmpty() && !stamps.peekFirst().isAfter(cutoff)) {
            stamps.removeFirst();
        }
        return stamps.size();
    }
}
