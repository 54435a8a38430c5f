package com.hivestate.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Input to task creation. Only {@code metadata} is usually set by callers; the remaining
 * fields let migration carry a legacy task over unchanged.
 *
 * @param taskId      explicit identifier, or null to let the store generate one
 * @param status      initial status, null means pending
 * @param agentId     owning agent, or null
 * @param priority    priority, null means {@link Task#DEFAULT_PRIORITY}
 * @param metadata    free-form document
 * @param createdAt   creation time, null means now
 * @param startedAt   optional start time
 * @param completedAt optional completion time
 * @param result      optional result document
 */
public record TaskDraft(
    String taskId,
    TaskStatus status,
    String agentId,
    Integer priority,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Object result
) {

    public TaskDraft {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static TaskDraft of(int priority, Map<String, Object> metadata) {
        return new TaskDraft(null, null, null, priority, metadata, null, null, null, null);
    }

    public static TaskDraft withMetadata(Map<String, Object> metadata) {
        return new TaskDraft(null, null, null, null, metadata, null, null, null, null);
    }

    public TaskStatus statusOrDefault() {
        return status == null ? TaskStatus.PENDING : status;
    }

    public int priorityOrDefault() {
        return priority == null ? Task.DEFAULT_PRIORITY : priority;
    }
}
