package com.hivestate.core.policy;

/**
 * Where a piece of state lives.
 */
public enum StoreLayer {
    /** Relational database, durable. */
    PERSISTENT,
    /** Key/value cache with TTLs. */
    EPHEMERAL,
    /** Append-only streams read through consumer groups. */
    STREAM
}
