package com.hivestate.core.orchestration;

import com.hivestate.core.store.ErrorKind;

/**
 * Thrown when a read cannot be answered because the persistent store is unreachable.
 * A missing entity is never reported this way.
 */
public class StateUnavailableException extends RuntimeException {

    private final ErrorKind errorKind;

    public StateUnavailableException(String message, ErrorKind errorKind) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
