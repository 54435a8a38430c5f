package com.hivestate.core.health;

import java.util.Map;

/**
 * Health of one component of the state layer, as reported by the CLI and Actuator.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
