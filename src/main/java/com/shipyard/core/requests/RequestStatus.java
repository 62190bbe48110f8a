package com.shipyard.core.requests;

/**
 * Lifecycle of a user request handled by the execution engine.
 */
public enum RequestStatus {
    PENDING,
    PROCESSING,
    PLANNING,
    WAITING_APPROVAL,
    IMPLEMENTING,
    ACTIVE,
    RUNNING,
    COMPLETED,
    FAILED;

    /** Whether a request in this status still counts as in flight. */
    public boolean isOpen() {
        return this != COMPLETED && this != FAILED;
    }

    public boolean isTerminal() {
        return !isOpen();
    }
}
