package com.hivestate.core.store;

/**
 * Why a store operation was not performed.
 */
public enum ErrorKind {
    /** Store unreachable or the connection failed mid-call. */
    CONNECTIVITY,
    /** A bounded timeout expired; treated like a connectivity failure. */
    TIMEOUT,
    /** A conditional update lost to a concurrent writer. Not a system failure. */
    CONFLICT,
    /** Zero rows or keys matched. */
    NOT_FOUND,
    /** A constraint or data-format violation. */
    INTEGRITY,
    /** The store is disabled or was never initialized. */
    UNAVAILABLE;

    /**
     * Whether this kind means the store itself could not be reached.
     */
    public boolean isInfrastructure() {
        return this == CONNECTIVITY || this == TIMEOUT || this == UNAVAILABLE;
    }
}
