package com.argus.activity.json;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.model.LiveSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * JSON codec for activity rows as they travel over push channels and REST.
 * <p>
 * Property names are snake_case, enums use their lower-case wire names and
 * timestamps are ISO-8601 strings. Unknown columns are ignored so that new
 * backend columns do not break older viewers.
 */
public final class ActivityJson {

    private static final ObjectMapper MAPPER = configure(new ObjectMapper());

    private ActivityJson() {
    }

    /**
     * Apply the activity wire settings to an existing mapper.
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parse a pushed row given as JSON text.
     *
     * @throws IllegalArgumentException if the payload is not a valid activity row
     */
    public static ActivityLogEntry parseEntry(String json) {
        try {
            return requireIdentity(MAPPER.readValue(json, ActivityLogEntry.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed activity row: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert a pushed row given as a column map (the {@code new} record of an insert).
     *
     * @throws IllegalArgumentException if the row cannot be mapped
     */
    public static ActivityLogEntry fromRow(Map<String, ?> row) {
        if (row == null) {
            throw new IllegalArgumentException("Activity row is null");
        }
        return requireIdentity(MAPPER.convertValue(row, ActivityLogEntry.class));
    }

    public static LiveSession parseSession(String json) {
        try {
            return MAPPER.readValue(json, LiveSession.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed session row: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static ActivityLogEntry requireIdentity(ActivityLogEntry entry) {
        if (entry == null || entry.getId() == null || entry.getId().isBlank()) {
            throw new IllegalArgumentException("Activity row has no id");
        }
        return entry;
    }
}
