package com.ssot.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Turns {@link ChangeMessage}s into JSON text. Timestamps are written as ISO-8601 strings.
 */
public class ChangeMessageSerializer {

    private final ObjectMapper objectMapper;

    public ChangeMessageSerializer() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public ChangeMessageSerializer(@Nonnull ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @throws BroadcastException if a value carried by the message cannot be written as JSON
     */
    public String serialize(@Nonnull ChangeMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new BroadcastException("Could not serialize " + message.getType() + " message", e);
        }
    }
}
