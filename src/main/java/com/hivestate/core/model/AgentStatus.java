package com.hivestate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Liveness status of an agent. Stored lower case ({@code idle}, {@code busy}, {@code offline}).
 */
public enum AgentStatus {
    IDLE,
    BUSY,
    OFFLINE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored status value. Unknown values are rejected.
     */
    @JsonCreator
    public static AgentStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Agent status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Maps a status value written by the legacy embedded database, which also knew
     * {@code active} and {@code error}. Returns {@code null} for values it cannot map.
     */
    public static AgentStatus fromLegacy(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "idle" -> IDLE;
            case "busy", "active" -> BUSY;
            case "offline", "error" -> OFFLINE;
            default -> null;
        };
    }

    public boolean isActive() {
        return this == IDLE || this == BUSY;
    }
}
