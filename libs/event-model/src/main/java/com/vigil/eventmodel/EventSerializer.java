package com.vigil.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON serialization of {@link TimelineEvent}s.
 * <p>
 * The event kind is written as a {@code type} property holding the canonical {@link EventType}
 * name. Timestamps are ISO-8601 strings with nanosecond precision.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes an event to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(TimelineEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.type().value(), e);
        }
    }

    /**
     * Deserializes a JSON string to an event of the kind named by its {@code type} property.
     *
     * @throws EventSerializationException if the JSON is malformed or names an unknown kind
     */
    public static TimelineEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, TimelineEvent.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /**
     * Deserializes, returning empty on failure.
     */
    public static Optional<TimelineEvent> tryDeserialize(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
