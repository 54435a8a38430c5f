package com.hivestate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Named recovery payload. Append-only.
 */
public record Checkpoint(
    long id,
    String name,
    Instant timestamp,
    Map<String, Object> data
) implements Serializable {

    public Checkpoint {
        data = data == null ? Map.of() : data;
    }
}
