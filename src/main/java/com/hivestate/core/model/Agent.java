package com.hivestate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable state of a single agent. The persistent store owns it; a denormalized copy is
 * cached under {@code agent:state:{agentId}}.
 *
 * @param agentId            stable unique identifier
 * @param status             idle, busy or offline
 * @param currentTaskId      task the agent is bound to, or null
 * @param contextUsage       fraction of the context window in use (0.0 to 1.0)
 * @param lastActivity       last time the agent registered or changed state
 * @param capabilities       ordered capability names
 * @param performanceMetrics arbitrary numeric metrics keyed by name
 */
public record Agent(
    String agentId,
    AgentStatus status,
    String currentTaskId,
    double contextUsage,
    Instant lastActivity,
    List<String> capabilities,
    Map<String, Number> performanceMetrics
) implements Serializable {

    public Agent {
        // Documents may carry JSON nulls; those entries are dropped.
        capabilities = capabilities == null ? List.of()
                : capabilities.stream().filter(Objects::nonNull).toList();
        performanceMetrics = performanceMetrics == null ? Map.of() : withoutNulls(performanceMetrics);
    }

    private static Map<String, Number> withoutNulls(Map<String, Number> metrics) {
        Map<String, Number> copy = new LinkedHashMap<>();
        metrics.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public Optional<String> currentTask() {
        return Optional.ofNullable(currentTaskId);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Optional<Double> metric(String name) {
        Number value = performanceMetrics.get(name);
        return value == null ? Optional.empty() : Optional.of(value.doubleValue());
    }
}
