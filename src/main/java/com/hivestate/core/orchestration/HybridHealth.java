package com.hivestate.core.orchestration;

import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.health.HealthStatus;
import com.hivestate.core.persistence.PersistentStoreHealth;

/**
 * Aggregated health of both stores plus the cache-hit check.
 * <p>
 * The persistent store being down makes the whole layer {@code DOWN}. A missing cache or
 * a hit ratio under target only makes it {@code DEGRADED}.
 */
public record HybridHealth(
    HealthStatus.Status status,
    PersistentStoreHealth persistent,
    EphemeralStoreHealth ephemeral,
    PerformanceStats performance
) {

    public static HybridHealth of(PersistentStoreHealth persistent, EphemeralStoreHealth ephemeral,
                                  PerformanceStats performance) {
        HealthStatus.Status status;
        if (!persistent.connected()) {
            status = HealthStatus.Status.DOWN;
        } else if (!ephemeral.connected() || !performance.performanceOk()) {
            status = HealthStatus.Status.DEGRADED;
        } else {
            status = HealthStatus.Status.UP;
        }
        return new HybridHealth(status, persistent, ephemeral, performance);
    }

    /**
     * Both stores reachable and the hit ratio on target.
     */
    public boolean healthy() {
        return status == HealthStatus.Status.UP;
    }
}
