package com.hivestate.core.health;

import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.orchestration.HybridHealth;
import com.hivestate.core.orchestration.PerformanceStats;
import com.hivestate.core.orchestration.StateManager;
import com.hivestate.core.persistence.PersistentStoreHealth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private static final PersistentStoreHealth DB_UP = new PersistentStoreHealth(NOW, true,
            new PersistentStoreHealth.PoolStats(5, 1, 4, 0, 5, 20), 0.4, 1.2, null);
    private static final EphemeralStoreHealth CACHE_UP = new EphemeralStoreHealth(NOW, true, true, 0.3,
            Map.of("tasks:pending", new EphemeralStoreHealth.StreamInfo(12, 2)), null);
    private static final PerformanceStats ON_TARGET = new PerformanceStats(96, 4, 100, 10, 1.5, 0.96, 0.95, true);
    private static final PerformanceStats BELOW_TARGET = new PerformanceStats(50, 50, 100, 10, 1.5, 0.5, 0.95, false);

    private static List<HealthStatus> check(PersistentStoreHealth db, EphemeralStoreHealth cache,
                                            PerformanceStats stats) {
        StateManager stateManager = mock(StateManager.class);
        when(stateManager.healthCheck()).thenReturn(HybridHealth.of(db, cache, stats));
        return new HealthCheckService(stateManager).checkAll();
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns database, cache and cache-hit-ratio components")
    void checkAllReturnsAllComponents() {
        List<HealthStatus> results = check(DB_UP, CACHE_UP, ON_TARGET);

        assertEquals(List.of("database", "cache", "cache-hit-ratio"),
                results.stream().map(HealthStatus::component).toList());
        assertTrue(results.stream().allMatch(HealthStatus::isUp));
    }

    @Test
    @DisplayName("Database metadata includes pool usage")
    void databaseMetadata() {
        HealthStatus database = component(check(DB_UP, CACHE_UP, ON_TARGET), "database");

        assertEquals("1 active / 4 idle / 20 max", database.metadata().get("pool"));
        assertEquals("1.200", database.metadata().get("queryMs"));
    }

    @Test
    @DisplayName("Cache metadata lists each stream")
    void cacheMetadata() {
        HealthStatus cache = component(check(DB_UP, CACHE_UP, ON_TARGET), "cache");

        assertEquals("12 entries, 2 groups", cache.metadata().get("tasks:pending"));
    }

    @Test
    @DisplayName("Database unreachable -> database DOWN")
    void databaseDown() {
        HealthStatus database = component(
                check(PersistentStoreHealth.down(NOW, "Connection refused"), CACHE_UP, ON_TARGET), "database");

        assertEquals(HealthStatus.Status.DOWN, database.status());
        assertTrue(database.detail().contains("Connection refused"));
    }

    @Test
    @DisplayName("Cache unreachable or disabled -> cache DEGRADED")
    void cacheDegraded() {
        HealthStatus unreachable = component(
                check(DB_UP, EphemeralStoreHealth.down(NOW, true, "timeout"), ON_TARGET), "cache");
        HealthStatus disabled = component(
                check(DB_UP, EphemeralStoreHealth.down(NOW, false, null), ON_TARGET), "cache");

        assertEquals(HealthStatus.Status.DEGRADED, unreachable.status());
        assertTrue(unreachable.detail().contains("timeout"));
        assertEquals(HealthStatus.Status.DEGRADED, disabled.status());
        assertTrue(disabled.detail().contains("disabled"));
    }

    @Test
    @DisplayName("Hit ratio below target -> cache-hit-ratio DEGRADED")
    void hitRatioBelowTarget() {
        HealthStatus ratio = component(check(DB_UP, CACHE_UP, BELOW_TARGET), "cache-hit-ratio");

        assertEquals(HealthStatus.Status.DEGRADED, ratio.status());
        assertEquals("0.500", ratio.metadata().get("hitRatio"));
        assertEquals("100", ratio.metadata().get("lookups"));
    }
}
