package com.hivestate.core.model;

import java.util.Map;

/**
 * Partial agent update. A null field keeps the stored value.
 */
public record AgentStateUpdate(
    AgentStatus status,
    String currentTaskId,
    Double contextUsage,
    Map<String, Number> performanceMetrics
) {

    public static AgentStateUpdate status(AgentStatus status) {
        return new AgentStateUpdate(status, null, null, null);
    }

    public static AgentStateUpdate contextUsage(double contextUsage) {
        return new AgentStateUpdate(null, null, contextUsage, null);
    }

    public AgentStateUpdate withCurrentTask(String taskId) {
        return new AgentStateUpdate(status, taskId, contextUsage, performanceMetrics);
    }

    public AgentStateUpdate withPerformanceMetrics(Map<String, Number> metrics) {
        return new AgentStateUpdate(status, currentTaskId, contextUsage, metrics);
    }

    public boolean isEmpty() {
        return status == null && currentTaskId == null && contextUsage == null && performanceMetrics == null;
    }
}
