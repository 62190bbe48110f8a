package com.shipyard.core.permission;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of an approval request that is still waiting for a decision.
 */
public record PendingPermission(
    String id,
    String kind,
    Map<String, Object> payload,
    String projectId,
    String requestId,
    String inputPreview,
    Instant createdAt,
    Instant expiresAt
) {}
