package com.homeostat.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Actuator health for the governor. Reports UP in NORMAL, DEGRADED in ALERT, DEGRADED
 * and RECOVERY, OUT_OF_SERVICE in LOCKDOWN, and DOWN when the sampler has stalled.
 */
@Component("homeostatHealthIndicator")
public class HomeostatHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final HealthCheckService healthCheckService;

    public HomeostatHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        List<HealthStatus> statuses = healthCheckService.checkAll();
        var builder = Health.status(toActuator(HealthCheckService.overall(statuses)));
        for (HealthStatus s : statuses) {
            builder.withDetail(s.component(), s.status() + ": " + s.detail());
            s.metadata().forEach((k, v) -> builder.withDetail(s.component() + "." + k, v));
        }
        return builder.build();
    }

    static Status toActuator(HealthStatus.Status status) {
        return switch (status) {
            case UP -> Status.UP;
            case DEGRADED -> DEGRADED;
            case OUT_OF_SERVICE -> Status.OUT_OF_SERVICE;
            case DOWN -> Status.DOWN;
        };
    }
}
