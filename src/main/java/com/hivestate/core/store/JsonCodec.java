package com.hivestate.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;

/**
 * Jackson-backed conversion between structured documents and their JSON text form.
 * Used for JSONB columns, cache payloads and stream fields.
 */
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Number>> NUMBER_MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec() {
        this(defaultObjectMapper());
    }

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Serializes a nullable value; null stays null so SQL can keep the column value.
     */
    public String writeNullable(Object value) {
        return value == null ? null : write(value);
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return readTyped(json, MAP_TYPE);
    }

    public List<String> readStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return readTyped(json, STRING_LIST_TYPE);
    }

    public Map<String, Number> readNumberMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return readTyped(json, NUMBER_MAP_TYPE);
    }

    /**
     * Reads any JSON document into plain maps, lists and scalars.
     */
    public Object readValue(String json) {
        if (json == null) {
            return null;
        }
        return read(json, Object.class);
    }

    /**
     * Parses text that may or may not be JSON. Non-JSON text is returned unchanged.
     */
    public Object readLenient(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, Object.class);
            } catch (JsonProcessingException e) {
                return text;
            }
        }
        return text;
    }

    private <T> T readTyped(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize JSON document", e);
        }
    }
}
