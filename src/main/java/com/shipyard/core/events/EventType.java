package com.shipyard.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types carried on a project stream, with the {@code type} string used on the wire.
 */
public enum EventType {
    CONNECTED("connected"),
    HEARTBEAT("heartbeat"),
    STATUS("status"),
    PREVIEW_STATUS("preview_status"),
    REQUEST_STATUS("request_status"),
    LOG("log"),
    ERROR("error"),
    TASK_STARTED("task_started"),
    TASK_COMPLETED("task_completed"),
    TASK_INTERRUPTED("task_interrupted"),
    TASK_ERROR("task_error"),
    FILE_CHANGE("file_change");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTaskLifecycle() {
        return this == TASK_STARTED || this == TASK_COMPLETED
                || this == TASK_INTERRUPTED || this == TASK_ERROR;
    }
}
