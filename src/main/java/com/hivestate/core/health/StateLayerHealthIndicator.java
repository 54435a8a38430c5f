package com.hivestate.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the hybrid state layer.
 * The database down is DOWN; cache problems report DEGRADED.
 */
@Component
public class StateLayerHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public StateLayerHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        boolean down = false;
        boolean degraded = false;

        for (HealthStatus status : healthCheckService.checkAll()) {
            builder.withDetail(status.component(), status.status() + ": " + status.detail());
            down |= status.status() == HealthStatus.Status.DOWN;
            degraded |= status.status() == HealthStatus.Status.DEGRADED;
        }

        if (down) {
            return builder.down().build();
        }
        return degraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
