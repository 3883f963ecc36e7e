package com.homeostat.core.sensor;

import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Built-in metric collectors. Additional {@link MetricCollector} beans are picked up
 * by the sampler automatically.
 */
@Configuration
public class SensorConfig {

    public static final String TASK_FAILURES = "task_failures";
    public static final String POLICY_VIOLATIONS = "policy_violations";

    @Bean
    public MetricCollector cpuLoadCollector() {
        return new CpuLoadCollector();
    }

    @Bean
    public MetricCollector memoryUsedCollector() {
        return new MemoryUsedCollector();
    }

    @Bean
    public MetricCollector taskFailuresCollector(EventBus eventBus) {
        return new EventCountCollector(TASK_FAILURES, Set.of(HomeostatEvent.TASK_FAILED), eventBus);
    }

    @Bean
    public MetricCollector policyViolationsCollector(EventBus eventBus) {
        return new EventCountCollector(POLICY_VIOLATIONS, Set.of(HomeostatEvent.POLICY_VIOLATION), eventBus);
    }

    @Bean
    public MetricCollector activeTasksCollector(EventBus eventBus) {
        return new ActiveTasksCollector(eventBus);
    }
}
