package com.shipyard.core.requests;

import java.time.Instant;

/**
 * One row of the request store.
 *
 * @param id           client-provided request id
 * @param projectId    project the request targets
 * @param instruction  the user's instruction text
 * @param status       current lifecycle status
 * @param errorMessage set when the request failed
 * @param createdAt    when the request was first stored
 * @param completedAt  set once the status is terminal
 */
public record UserRequest(
    String id,
    String projectId,
    String instruction,
    RequestStatus status,
    String errorMessage,
    Instant createdAt,
    Instant completedAt
) {
    public UserRequest withStatus(RequestStatus newStatus, String error) {
        Instant completed = newStatus.isTerminal() ? Instant.now() : null;
        String message = newStatus == RequestStatus.FAILED ? error : null;
        return new UserRequest(id, projectId, instruction, newStatus, message, createdAt, completed);
    }
}
