package com.hivestate.core.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    @Test
    @DisplayName("instants are written as ISO-8601 text")
    void writesIsoInstants() {
        String json = codec.write(Map.of("at", Instant.parse("2025-03-01T10:00:00Z")));
        assertEquals("{\"at\":\"2025-03-01T10:00:00Z\"}", json);
    }

    @Test
    @DisplayName("null stays null through writeNullable and readValue")
    void nulls() {
        assertNull(codec.writeNullable(null));
        assertNull(codec.readValue(null));
        assertEquals("[]", codec.writeNullable(List.of()));
    }

    @Test
    @DisplayName("null or blank documents read as empty collections")
    void blankDocuments() {
        assertEquals(Map.of(), codec.readMap(null));
        assertEquals(Map.of(), codec.readMap("  "));
        assertEquals(List.of(), codec.readStringList(""));
        assertEquals(Map.of(), codec.readNumberMap(null));
    }

    @Test
    @DisplayName("typed readers decode lists and numeric maps")
    void typedReaders() {
        assertEquals(List.of("python", "sql"), codec.readStringList("[\"python\",\"sql\"]"));

        Map<String, Number> metrics = codec.readNumberMap("{\"tasks_completed\":12,\"success_rate\":0.75}");
        assertEquals(12, metrics.get("tasks_completed").intValue());
        assertEquals(0.75, metrics.get("success_rate").doubleValue(), 1e-9);
    }

    @Test
    @DisplayName("malformed documents raise IllegalArgumentException")
    void malformed() {
        assertThrows(IllegalArgumentException.class, () -> codec.readMap("{not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.readStringList("{\"a\":1}"));
        assertThrows(IllegalArgumentException.class, () -> codec.read("[", Map.class));
    }

    @Test
    @DisplayName("lenient reads fall back to the raw text")
    void lenient() {
        assertEquals(Map.of("a", 1), codec.readLenient(" {\"a\":1} "));
        assertEquals("plain text", codec.readLenient("plain text"));
        assertEquals("{broken", codec.readLenient("{broken"));
        assertNull(codec.readLenient(null));
    }
}
