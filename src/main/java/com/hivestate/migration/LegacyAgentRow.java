package com.hivestate.migration;

/**
 * Raw agent row as stored in the legacy database. Documents are still JSON text.
 */
public record LegacyAgentRow(
    String agentId,
    String status,
    String currentTaskId,
    Double contextUsage,
    String lastActivity,
    String capabilities,
    String performanceMetrics
) {
}
