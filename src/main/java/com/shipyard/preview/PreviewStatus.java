package com.shipyard.preview;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of a project's preview.
 *
 * @param port null when no port is held
 * @param url  null when no port is held
 */
public record PreviewStatus(
    String projectId,
    PreviewState state,
    Integer port,
    String url,
    String message
) {

    public static PreviewStatus idle(String projectId) {
        return new PreviewStatus(projectId, PreviewState.IDLE, null, null, null);
    }

    /**
     * Payload of a {@code preview_status} event.
     */
    public Map<String, Object> toEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", state.wireName());
        if (port != null) {
            data.put("port", port);
            data.put("url", url);
        }
        if (message != null) {
            data.put("message", message);
        }
        return data;
    }
}
