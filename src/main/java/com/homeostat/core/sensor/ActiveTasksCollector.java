package com.homeostat.core.sensor;

import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Number of tasks currently in flight, tracked from task lifecycle events.
 */
public class ActiveTasksCollector implements MetricCollector {

    public static final String METRIC = "active_tasks";

    private final AtomicLong active = new AtomicLong();

    public ActiveTasksCollector(EventBus eventBus) {
        eventBus.subscribeAll(event -> {
            switch (event.eventType()) {
                case HomeostatEvent.TASK_STARTED -> active.incrementAndGet();
                case HomeostatEvent.TASK_COMPLETED, HomeostatEvent.TASK_FAILED ->
                        active.updateAndGet(n -> Math.max(0, n - 1));
                default -> { }
            }
        });
    }

    @Override
    public String metric() {
        return METRIC;
    }

    @Override
    public double collect() {
        return active.get();
    }
}
