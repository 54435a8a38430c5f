package com.hivestate.core.persistence;

import java.time.Instant;

/**
 * Result of a persistent store health check.
 *
 * @param timestamp          when the check ran
 * @param connected          whether a pooled connection answered
 * @param pool               connection pool statistics, null when unavailable
 * @param connectionAcquireMs time to borrow a connection
 * @param sampleQueryMs      latency of a {@code SELECT 1} round trip
 * @param error              failure detail when not connected
 */
public record PersistentStoreHealth(
    Instant timestamp,
    boolean connected,
    PoolStats pool,
    double connectionAcquireMs,
    double sampleQueryMs,
    String error
) {

    public record PoolStats(int total, int active, int idle, int awaiting, int minIdle, int maxSize) {}

    public static PersistentStoreHealth down(Instant timestamp, String error) {
        return new PersistentStoreHealth(timestamp, false, null, 0, 0, error);
    }
}
