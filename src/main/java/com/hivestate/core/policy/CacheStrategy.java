package com.hivestate.core.policy;

/**
 * How an operation touches the cache relative to its authoritative store.
 */
public enum CacheStrategy {
    /** Persistent store only; the cache is at most refreshed or invalidated afterwards. */
    DB_ONLY,
    /** Authoritative write first, then overwrite the cache with the full fresh value. */
    WRITE_THROUGH,
    /** Read the cache, fall back to the persistent store on a miss and repopulate. */
    CACHE_ASIDE,
    /** State that only ever lives in the cache. */
    CACHE_ONLY,
    /** Append to a stream. */
    STREAM_APPEND
}
