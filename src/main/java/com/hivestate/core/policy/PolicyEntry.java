package com.hivestate.core.policy;

import java.time.Duration;

/**
 * One row of the distribution table.
 *
 * @param operation      the routed operation
 * @param layer          store that holds the authoritative copy
 * @param consistency    guarantee callers can rely on
 * @param strategy       how the cache is involved
 * @param ttl            cache lifetime, null when nothing is cached
 * @param keyPattern     cache key or stream name, null when nothing is cached
 * @param refreshesCache whether a successful write re-caches the fresh value
 */
public record PolicyEntry(
    StateOperation operation,
    StoreLayer layer,
    ConsistencyLevel consistency,
    CacheStrategy strategy,
    Duration ttl,
    String keyPattern,
    boolean refreshesCache
) {

    public boolean isStrong() {
        return consistency == ConsistencyLevel.STRONG;
    }

    public boolean readsCache() {
        return strategy == CacheStrategy.CACHE_ASIDE || strategy == CacheStrategy.CACHE_ONLY;
    }
}
