package com.hivestate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a task: pending -> assigned -> (in_progress) -> completed | failed.
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Maps a status value written by the legacy embedded database ({@code running},
     * {@code cancelled}). Returns {@code null} for values it cannot map.
     */
    public static TaskStatus fromLegacy(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "assigned" -> ASSIGNED;
            case "in_progress", "running" -> IN_PROGRESS;
            case "completed" -> COMPLETED;
            case "failed", "cancelled" -> FAILED;
            default -> null;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
