package com.shipyard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event published on a project stream.
 *
 * @param type      what happened; serialized as the wire {@code type}
 * @param projectId the project whose subscribers receive the event
 * @param data      payload serialized as the wire {@code data} object (may be empty)
 * @param timestamp when the event was created
 */
public record ShipyardEvent(
    EventType type,
    String projectId,
    Map<String, Object> data,
    Instant timestamp
) implements Serializable {

    public ShipyardEvent {
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ShipyardEvent of(EventType type, String projectId, Map<String, Object> data) {
        return new ShipyardEvent(type, projectId, data, Instant.now());
    }

    /**
     * A {@code status} event whose payload carries {@code status} plus any extra fields.
     */
    public static ShipyardEvent status(String projectId, String status, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        if (extra != null) {
            data.putAll(extra);
        }
        return of(EventType.STATUS, projectId, data);
    }

    public static ShipyardEvent error(String projectId, String message) {
        return of(EventType.ERROR, projectId, Map.of("message", message));
    }
}
