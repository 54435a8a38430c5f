package com.hivestate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A unit of work tracked by the persistent store.
 *
 * @param taskId      store-generated identifier (preserved legacy id for migrated tasks)
 * @param status      lifecycle status
 * @param agentId     agent that won the assignment, or null while pending
 * @param priority    higher is more urgent
 * @param createdAt   creation time
 * @param startedAt   set on assignment
 * @param completedAt set when the task reaches completed or failed
 * @param metadata    free-form document
 * @param result      free-form result document, or null
 */
public record Task(
    String taskId,
    TaskStatus status,
    String agentId,
    int priority,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Map<String, Object> metadata,
    Object result
) implements Serializable {

    public static final int DEFAULT_PRIORITY = 5;

    public Task {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public Optional<String> assignedAgent() {
        return Optional.ofNullable(agentId);
    }

    public Optional<Object> metadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }
}
