package com.hivestate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A notification appended to the {@code events:system} stream.
 *
 * @param eventType dotted event name, e.g. {@code task.assigned}
 * @param agentId   agent the event relates to (nullable)
 * @param taskId    task the event relates to (nullable)
 * @param payload   arbitrary key-value data
 * @param timestamp when the event occurred
 */
public record StateEvent(
    String eventType,
    String agentId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_ASSIGNED = "task.assigned";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String MIGRATION_COMPLETED = "migration.completed";

    public StateEvent {
        payload = payload == null ? Map.of() : payload;
    }

    /**
     * Flattens the event into stream fields. Null ids are left out.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", eventType);
        if (agentId != null) {
            fields.put("agent_id", agentId);
        }
        if (taskId != null) {
            fields.put("task_id", taskId);
        }
        if (!payload.isEmpty()) {
            fields.put("payload", payload);
        }
        fields.put("timestamp", timestamp.toString());
        return fields;
    }
}
