package com.shipyard.core.requests;

import com.shipyard.core.events.EventHub;
import com.shipyard.core.events.EventType;
import com.shipyard.core.events.ShipyardEvent;
import com.shipyard.core.events.SnapshotContributor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives {@link TaskStatusSummary} from whatever the {@link RequestStore} currently reports.
 * Nothing is cached; every call reads the store.
 */
@Service
@Order(20)
public class TaskStatusTracker implements SnapshotContributor {

    private static final Logger log = LoggerFactory.getLogger(TaskStatusTracker.class);

    private final RequestStore requestStore;
    private final EventHub eventHub;

    public TaskStatusTracker(RequestStore requestStore, EventHub eventHub) {
        this.requestStore = requestStore;
        this.eventHub = eventHub;
    }

    public TaskStatusSummary summarize(String projectId) {
        int active = (int) requestStore.findByProject(projectId).stream()
                .filter(r -> r.status() != null && r.status().isOpen())
                .count();
        return TaskStatusSummary.of(active);
    }

    /** Pushes the current summary to the project's live connections. */
    public TaskStatusSummary publishSummary(String projectId) {
        TaskStatusSummary summary = summarize(projectId);
        log.debug("Project {} has {} active request(s)", projectId, summary.activeCount());
        eventHub.publish(toEvent(projectId, summary));
        return summary;
    }

    @Override
    public ShipyardEvent snapshot(String projectId) {
        return toEvent(projectId, summarize(projectId));
    }

    private static ShipyardEvent toEvent(String projectId, TaskStatusSummary summary) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("hasActiveRequests", summary.hasActiveRequests());
        data.put("activeCount", summary.activeCount());
        return ShipyardEvent.of(EventType.REQUEST_STATUS, projectId, data);
    }
}
