package com.hivestate.core.store;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed outcome of a store operation. Store managers never throw across their public
 * boundary; they return one of these instead.
 *
 * @param ok        whether the operation was performed
 * @param value     the produced value when {@code ok}, otherwise null
 * @param errorKind the failure category when not {@code ok}, otherwise null
 * @param message   human readable failure detail, otherwise null
 */
public record StoreResult<T>(boolean ok, T value, ErrorKind errorKind, String message) {

    public StoreResult {
        if (ok && errorKind != null) {
            throw new IllegalArgumentException("A successful result cannot carry an error kind");
        }
        if (!ok) {
            Objects.requireNonNull(errorKind, "A failed result needs an error kind");
        }
    }

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(true, value, null, null);
    }

    public static StoreResult<Boolean> done() {
        return success(Boolean.TRUE);
    }

    public static <T> StoreResult<T> failure(ErrorKind kind, String message) {
        return new StoreResult<>(false, null, kind, message);
    }

    public static <T> StoreResult<T> notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    public static <T> StoreResult<T> conflict(String message) {
        return failure(ErrorKind.CONFLICT, message);
    }

    public boolean failed() {
        return !ok;
    }

    public boolean is(ErrorKind kind) {
        return !ok && errorKind == kind;
    }

    public Optional<T> toOptional() {
        return ok ? Optional.ofNullable(value) : Optional.empty();
    }

    public T orElse(T fallback) {
        return ok && value != null ? value : fallback;
    }
}
