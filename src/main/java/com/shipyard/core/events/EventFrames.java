package com.shipyard.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text event-stream framing: {@code data: <json>\n\n} where the JSON object is
 * {@code {"type": ..., "data": {...}}}.
 */
public final class EventFrames {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private EventFrames() {}

    public static String encode(ShipyardEvent event) {
        return "data: " + toJson(event) + "\n\n";
    }

    public static String toJson(ShipyardEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", event.type().wireName());
        if (!event.data().isEmpty()) {
            body.put("data", event.data());
        }
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable: " + event.type(), e);
        }
    }
}
