package com.shipyard.core.requests;

import java.util.List;
import java.util.Optional;

/**
 * Queryable list of user requests. Provided by the host application; Shipyard only reads it,
 * apart from the in-memory default used when no other store is configured.
 */
public interface RequestStore {

    /** Current rows for a project, in no particular order. */
    List<UserRequest> findByProject(String projectId);

    Optional<UserRequest> findById(String requestId);
}
