package com.shipyard.core.requests;

import com.shipyard.core.events.EventHub;
import com.shipyard.core.events.EventType;
import com.shipyard.core.events.ShipyardEvent;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishing helpers for the execution engine: task lifecycle, file changes and log lines.
 * Each lifecycle event is followed by a fresh {@code request_status} summary.
 */
@Service
public class TaskEvents {

    private final EventHub eventHub;
    private final TaskStatusTracker tracker;

    public TaskEvents(EventHub eventHub, TaskStatusTracker tracker) {
        this.eventHub = eventHub;
        this.tracker = tracker;
    }

    public void taskStarted(String projectId, String requestId, String message) {
        lifecycle(EventType.TASK_STARTED, projectId, requestId, message, null);
    }

    public void taskCompleted(String projectId, String requestId, String message) {
        lifecycle(EventType.TASK_COMPLETED, projectId, requestId, message, null);
    }

    public void taskInterrupted(String projectId, String requestId, String message) {
        lifecycle(EventType.TASK_INTERRUPTED, projectId, requestId, message, null);
    }

    public void taskFailed(String projectId, String requestId, String message, String error) {
        lifecycle(EventType.TASK_ERROR, projectId, requestId, message, error);
    }

    /**
     * @param changeType "write" or "edit"
     */
    public void fileChanged(String projectId, String requestId, String changeType, String filePath) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", changeType);
        data.put("filePath", filePath);
        data.put("timestamp", Instant.now().toString());
        if (requestId != null) {
            data.put("requestId", requestId);
        }
        eventHub.publish(ShipyardEvent.of(EventType.FILE_CHANGE, projectId, data));
    }

    /**
     * @param level  stdout, stderr, info, warn or error
     * @param source preview, cli, build or system
     */
    public void log(String projectId, String level, String source, String content) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", level);
        data.put("content", content);
        data.put("source", source);
        data.put("projectId", projectId);
        data.put("timestamp", Instant.now().toString());
        eventHub.publish(ShipyardEvent.of(EventType.LOG, projectId, data));
    }

    private void lifecycle(EventType type, String projectId, String requestId, String message, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectId", projectId);
        if (requestId != null) {
            data.put("requestId", requestId);
        }
        data.put("timestamp", Instant.now().toString());
        data.put("message", message);
        if (error != null) {
            data.put("error", error);
        }
        eventHub.publish(ShipyardEvent.of(type, projectId, data));
        tracker.publishSummary(projectId);
    }
}
