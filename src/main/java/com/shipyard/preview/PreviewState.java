package com.shipyard.preview;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a project's dev-server preview.
 */
public enum PreviewState {
    IDLE,
    STARTING,
    RUNNING,
    READY,
    ERROR,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** A preview in this state owns a process and a port. */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == READY;
    }
}
