package com.shipyard.core.requests;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RequestStore}. Contents are lost on restart.
 */
public class InMemoryRequestStore implements RequestStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRequestStore.class);

    private final ConcurrentHashMap<String, UserRequest> requests = new ConcurrentHashMap<>();

    /**
     * Creates the request in {@link RequestStatus#PENDING}, or replaces the instruction of an
     * existing request while keeping its status.
     */
    public UserRequest upsert(String id, String projectId, String instruction) {
        return requests.compute(id, (key, existing) -> existing == null
                ? new UserRequest(id, projectId, instruction, RequestStatus.PENDING, null, Instant.now(), null)
                : new UserRequest(id, existing.projectId(), instruction, existing.status(),
                        existing.errorMessage(), existing.createdAt(), existing.completedAt()));
    }

    /**
     * @return the updated request, or empty when the id is unknown
     */
    public Optional<UserRequest> updateStatus(String id, RequestStatus status, String errorMessage) {
        UserRequest updated = requests.computeIfPresent(id, (key, existing) -> existing.withStatus(status, errorMessage));
        if (updated == null) {
            log.warn("Request {} not found; status {} not applied", id, status);
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public List<UserRequest> findByProject(String projectId) {
        return requests.values().stream()
                .filter(r -> projectId.equals(r.projectId()))
                .toList();
    }

    @Override
    public Optional<UserRequest> findById(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }
}
