package com.shipyard.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventFramesTest {

    @Test
    @DisplayName("frames an event as a single data line followed by a blank line")
    void framesEvent() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "ready");
        data.put("port", 3135);

        String frame = EventFrames.encode(ShipyardEvent.of(EventType.PREVIEW_STATUS, "P1", data));

        assertEquals("data: {\"type\":\"preview_status\",\"data\":{\"status\":\"ready\",\"port\":3135}}\n\n", frame);
    }

    @Test
    @DisplayName("omits data when the payload is empty")
    void omitsEmptyData() {
        assertEquals("{\"type\":\"heartbeat\"}",
                EventFrames.toJson(ShipyardEvent.of(EventType.HEARTBEAT, "P1", null)));
    }

    @Test
    @DisplayName("status events put status before extra fields")
    void statusEventOrdering() {
        var event = ShipyardEvent.status("P1", "permission_resolved", Map.of("requestId", "r1"));

        assertEquals("{\"type\":\"status\",\"data\":{\"status\":\"permission_resolved\",\"requestId\":\"r1\"}}",
                EventFrames.toJson(event));
    }
}
