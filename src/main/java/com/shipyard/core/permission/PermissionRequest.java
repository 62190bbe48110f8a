package com.shipyard.core.permission;

import java.util.Map;

/**
 * An approval request raised by the execution engine before it runs a gated action.
 *
 * @param id        caller-supplied id, unique across the process (the engine uses its tool-use id)
 * @param kind      tool or action name, e.g. "Bash", "Write"
 * @param payload   the action's input, shown to the human deciding
 * @param projectId project the action belongs to; nullable when the caller has no project scope
 * @param requestId user request that triggered the action; nullable
 */
public record PermissionRequest(
    String id,
    String kind,
    Map<String, Object> payload,
    String projectId,
    String requestId
) {
    public PermissionRequest {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Permission id is required");
        }
        payload = payload == null ? Map.of() : payload;
    }
}
