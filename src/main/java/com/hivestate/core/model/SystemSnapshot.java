package com.hivestate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time aggregate of agent and task state. Append-only.
 */
public record SystemSnapshot(
    long id,
    Instant timestamp,
    int totalAgents,
    int activeAgents,
    int totalTasks,
    int completedTasks,
    int failedTasks,
    double averageContextUsage,
    double qualityScore,
    Map<String, Object> metadata
) implements Serializable {

    public SystemSnapshot {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
