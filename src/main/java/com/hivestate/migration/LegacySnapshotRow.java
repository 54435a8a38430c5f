package com.hivestate.migration;

import java.time.Instant;

/**
 * Legacy system snapshot.
 *
 * @param timestamp    parsed timestamp, null when the stored text is not recognised
 * @param rawTimestamp timestamp text as stored in the legacy table
 */
public record LegacySnapshotRow(
    Instant timestamp,
    String rawTimestamp,
    int totalAgents,
    int activeAgents,
    int totalTasks,
    int completedTasks,
    int failedTasks,
    double averageContextUsage,
    double qualityScore
) {
}
