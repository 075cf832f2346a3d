package com.unievents.event.domain.model.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link EventPayload} as a JSON text column, keeping the "kind" tag.
 */
@Converter
public class EventPayloadConverter implements AttributeConverter<EventPayload, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    @Override
    public String convertToDatabaseColumn(EventPayload payload) {
        if (payload == null) return null;
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event payload of kind " + payload.eventType(), e);
        }
    }

    @Override
    public EventPayload convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, EventPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt event payload column", e);
        }
    }
}
