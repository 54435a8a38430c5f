package com.hivestate.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StateLayerHealthIndicatorTest {

    private static Health health(HealthStatus.Status database, HealthStatus.Status cache) {
        HealthCheckService service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(
                new HealthStatus("database", database, "db", Map.of()),
                new HealthStatus("cache", cache, "cache", Map.of())));
        return new StateLayerHealthIndicator(service).health();
    }

    @Test
    @DisplayName("All components UP -> UP with per-component details")
    void up() {
        Health health = health(HealthStatus.Status.UP, HealthStatus.Status.UP);

        assertEquals(Status.UP, health.getStatus());
        assertEquals("UP: db", health.getDetails().get("database"));
    }

    @Test
    @DisplayName("Cache DEGRADED -> DEGRADED")
    void degraded() {
        assertEquals("DEGRADED", health(HealthStatus.Status.UP, HealthStatus.Status.DEGRADED).getStatus().getCode());
    }

    @Test
    @DisplayName("Database DOWN wins over a degraded cache")
    void down() {
        assertEquals(Status.DOWN, health(HealthStatus.Status.DOWN, HealthStatus.Status.DEGRADED).getStatus());
    }
}
