package com.shipyard.dispatch.api;

import com.shipyard.core.requests.TaskStatusSummary;
import com.shipyard.core.requests.TaskStatusTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RequestStatusController {

    private final TaskStatusTracker taskStatusTracker;

    public RequestStatusController(TaskStatusTracker taskStatusTracker) {
        this.taskStatusTracker = taskStatusTracker;
    }

    @GetMapping("/api/projects/{projectId}/requests/active")
    public ResponseEntity<TaskStatusSummary> active(@PathVariable String projectId) {
        return ResponseEntity.ok(taskStatusTracker.summarize(projectId));
    }
}
