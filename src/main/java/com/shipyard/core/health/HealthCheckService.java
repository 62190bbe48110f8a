package com.shipyard.core.health;

import com.shipyard.core.events.EventHub;
import com.shipyard.core.permission.PermissionBroker;
import com.shipyard.preview.PortAllocator;
import com.shipyard.preview.PortRange;
import com.shipyard.preview.PreviewManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final EventHub eventHub;
    private final PermissionBroker permissionBroker;
    private final PreviewManager previewManager;
    private final PortAllocator portAllocator;

    public HealthCheckService(
            @Autowired(required = false) EventHub eventHub,
            @Autowired(required = false) PermissionBroker permissionBroker,
            @Autowired(required = false) PreviewManager previewManager,
            @Autowired(required = false) PortAllocator portAllocator) {
        this.eventHub = eventHub;
        this.permissionBroker = permissionBroker;
        this.previewManager = previewManager;
        this.portAllocator = portAllocator;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEventHub());
        results.add(checkPermissions());
        results.add(checkPreview());
        return results;
    }

    private HealthStatus checkEventHub() {
        if (eventHub == null) {
            return new HealthStatus("events", HealthStatus.Status.DOWN,
                    "Event hub not available", Map.of());
        }
        return new HealthStatus("events", HealthStatus.Status.UP,
                eventHub.totalConnections() + " live connection(s)",
                Map.of("connections", String.valueOf(eventHub.totalConnections())));
    }

    private HealthStatus checkPermissions() {
        if (permissionBroker == null) {
            return new HealthStatus("permissions", HealthStatus.Status.DOWN,
                    "Permission broker not available", Map.of());
        }
        int pending = permissionBroker.pendingCount();
        return new HealthStatus("permissions", HealthStatus.Status.UP,
                pending + " pending request(s)", Map.of("pending", String.valueOf(pending)));
    }

    private HealthStatus checkPreview() {
        if (previewManager == null || portAllocator == null) {
            return new HealthStatus("preview", HealthStatus.Status.DOWN,
                    "Preview supervisor not available", Map.of());
        }
        String active = String.valueOf(previewManager.activeCount());
        try {
            PortRange range = portAllocator.defaultRange();
            if (!portAllocator.hasFreePort()) {
                return new HealthStatus("preview", HealthStatus.Status.DEGRADED,
                        "No free port in " + range, Map.of("active", active, "range", range.toString()));
            }
            return new HealthStatus("preview", HealthStatus.Status.UP,
                    active + " active preview(s)", Map.of("active", active, "range", range.toString()));
        } catch (RuntimeException e) {
            log.warn("Preview health check failed: {}", e.getMessage());
            return new HealthStatus("preview", HealthStatus.Status.DEGRADED,
                    "Port range unusable: " + e.getMessage(), Map.of("active", active));
        }
    }
}
