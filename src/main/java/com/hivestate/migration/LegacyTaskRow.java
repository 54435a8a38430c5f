package com.hivestate.migration;

/**
 * Raw task row as stored in the legacy database.
 */
public record LegacyTaskRow(
    String taskId,
    String status,
    String agentId,
    Integer priority,
    String createdAt,
    String startedAt,
    String completedAt,
    String metadata
) {
}
