package com.fairway.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON form of {@link RevenueEvent}, used for the audit trail and for import/export.
 * <p>
 * Timestamps are ISO 8601 strings and amounts are written as plain decimals.
 */
public final class RevenueEventSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private RevenueEventSerializer() {
        // utility class
    }

    /**
     * @throws EventSerializationException if the event cannot be written
     */
    public static String serialize(RevenueEvent event) {
        return write(event, "event " + event.id());
    }

    /**
     * Serializes an arbitrary structured value (audit records, export rows).
     *
     * @throws EventSerializationException if the value cannot be written
     */
    public static String serializeValue(Object value) {
        return write(value, value.getClass().getSimpleName());
    }

    /**
     * @throws EventSerializationException if the JSON is malformed or names an unknown type
     */
    public static RevenueEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, RevenueEvent.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize revenue event", e);
        }
    }

    public static Optional<RevenueEvent> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Shared mapper, configured for {@code java.time} types. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + what, e);
        }
    }

    /**
     * Raised when a revenue event cannot be converted to or from JSON.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
