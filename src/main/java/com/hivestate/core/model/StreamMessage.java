package com.hivestate.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * An entry read from an append-only stream through a consumer group.
 *
 * @param stream    stream key, e.g. {@code tasks:pending}
 * @param messageId store-assigned monotonic id
 * @param fields    decoded payload; JSON-looking values are parsed, the rest stay strings
 */
public record StreamMessage(
    String stream,
    String messageId,
    Map<String, Object> fields
) implements Serializable {

    public String field(String name) {
        Object value = fields.get(name);
        return value == null ? null : value.toString();
    }
}
