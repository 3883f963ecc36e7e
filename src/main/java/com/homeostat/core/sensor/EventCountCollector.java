package com.homeostat.core.sensor;

import com.homeostat.core.events.EventBus;

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts bus events of the given types and reports the count since the previous
 * sample, so windowed sums give events per window.
 */
public class EventCountCollector implements MetricCollector {

    private final String metric;
    private final Set<String> eventTypes;
    private final AtomicLong count = new AtomicLong();

    public EventCountCollector(String metric, Set<String> eventTypes, EventBus eventBus) {
        this.metric = metric;
        this.eventTypes = Set.copyOf(eventTypes);
        eventBus.subscribeAll(event -> {
            if (this.eventTypes.contains(event.eventType())) {
                count.incrementAndGet();
            }
        });
    }

    @Override
    public String metric() {
        return metric;
    }

    @Override
    public double collect() {
        return count.getAndSet(0);
    }
}
