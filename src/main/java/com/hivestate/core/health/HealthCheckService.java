package com.hivestate.core.health;

import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.orchestration.HybridHealth;
import com.hivestate.core.orchestration.PerformanceStats;
import com.hivestate.core.orchestration.StateManager;
import com.hivestate.core.persistence.PersistentStoreHealth;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates the orchestrator's aggregated health into per-component statuses.
 */
@Service
public class HealthCheckService {

    private final StateManager stateManager;

    public HealthCheckService(StateManager stateManager) {
        this.stateManager = stateManager;
    }

    public List<HealthStatus> checkAll() {
        HybridHealth health = stateManager.healthCheck();
        return List.of(
                checkDatabase(health.persistent()),
                checkCache(health.ephemeral()),
                checkPerformance(health.performance()));
    }

    private HealthStatus checkDatabase(PersistentStoreHealth health) {
        if (!health.connected()) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + health.error(), Map.of());
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("acquireMs", format(health.connectionAcquireMs()));
        metadata.put("queryMs", format(health.sampleQueryMs()));
        if (health.pool() != null) {
            metadata.put("pool", health.pool().active() + " active / " + health.pool().idle() + " idle / "
                    + health.pool().maxSize() + " max");
        }
        return new HealthStatus("database", HealthStatus.Status.UP, "Database connection valid", metadata);
    }

    private HealthStatus checkCache(EphemeralStoreHealth health) {
        if (!health.enabled()) {
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                    "Cache disabled; reads served from the database", Map.of());
        }
        if (!health.connected()) {
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                    "Cache unreachable: " + health.error(), Map.of());
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("pingMs", format(health.pingMs()));
        health.streams().forEach((stream, info) ->
                metadata.put(stream, info.length() + " entries, " + info.groups() + " groups"));
        return new HealthStatus("cache", HealthStatus.Status.UP, "Cache reachable", metadata);
    }

    private HealthStatus checkPerformance(PerformanceStats stats) {
        Map<String, String> metadata = Map.of(
                "hitRatio", format(stats.cacheHitRatio()),
                "target", format(stats.hitRatioTarget()),
                "lookups", String.valueOf(stats.cacheLookups()));
        if (stats.performanceOk()) {
            return new HealthStatus("cache-hit-ratio", HealthStatus.Status.UP, "Hit ratio on target", metadata);
        }
        return new HealthStatus("cache-hit-ratio", HealthStatus.Status.DEGRADED,
                "Hit ratio below target", metadata);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
