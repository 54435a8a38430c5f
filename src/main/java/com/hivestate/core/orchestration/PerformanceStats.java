package com.hivestate.core.orchestration;

/**
 * Point-in-time copy of the orchestrator's running counters.
 *
 * @param cacheHits        cache-aside reads served from the cache
 * @param cacheMisses      cache-aside reads that fell through to the persistent store
 * @param readOperations   all reads routed by the orchestrator
 * @param writeOperations  all writes routed by the orchestrator
 * @param averageLatencyMs exponential moving average of operation latency
 * @param cacheHitRatio    hits / (hits + misses), 0 before the first lookup
 * @param hitRatioTarget   configured target ratio
 * @param performanceOk    whether the ratio meets the target (true before the first lookup)
 */
public record PerformanceStats(
    long cacheHits,
    long cacheMisses,
    long readOperations,
    long writeOperations,
    double averageLatencyMs,
    double cacheHitRatio,
    double hitRatioTarget,
    boolean performanceOk
) {

    public long cacheLookups() {
        return cacheHits + cacheMisses;
    }
}
