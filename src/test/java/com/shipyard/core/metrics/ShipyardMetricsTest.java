package com.shipyard.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ShipyardMetricsTest {

    private SimpleMeterRegistry registry;
    private ShipyardMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ShipyardMetrics(registry);
    }

    @Test
    @DisplayName("recordEventPublished counts publishes and deliveries by type")
    void recordEventPublished() {
        metrics.recordEventPublished("log", 3);
        metrics.recordEventPublished("log", 0);

        assertEquals(2.0, registry.find("shipyard.stream.events.published").tag("type", "log").counter().count());
        assertEquals(3.0, registry.find("shipyard.stream.events.delivered").tag("type", "log").counter().count());
    }

    @Test
    @DisplayName("connection gauge follows its supplier")
    void connectionGauge() {
        var live = new AtomicInteger(4);
        metrics.bindConnectionGauge(live::get);

        assertEquals(4.0, registry.find("shipyard.stream.connections").gauge().value());
        live.set(1);
        assertEquals(1.0, registry.find("shipyard.stream.connections").gauge().value());
    }

    @Test
    @DisplayName("recordConnectionDropped tags the reason")
    void recordConnectionDropped() {
        metrics.recordConnectionDropped("write-failed");

        assertNotNull(registry.find("shipyard.stream.connections.dropped").tag("reason", "write-failed").counter());
    }

    @Test
    @DisplayName("recordPermissionOutcome increments the outcome counter")
    void recordPermissionOutcome() {
        metrics.recordPermissionOutcome("expired");
        metrics.recordPermissionOutcome("expired");

        assertEquals(2.0, registry.find("shipyard.permissions.outcomes").tag("outcome", "expired").counter().count());
    }

    @Test
    @DisplayName("preview starts, failures and port allocations are recorded")
    void previewMetrics() {
        metrics.recordPreviewStart();
        metrics.recordPreviewFailure("crash");
        metrics.recordPortAllocation(12, false);

        assertEquals(1.0, registry.find("shipyard.preview.starts").counter().count());
        assertEquals(1.0, registry.find("shipyard.preview.failures").tag("reason", "crash").counter().count());
        assertEquals(1, registry.find("shipyard.preview.port.allocation").tag("result", "exhausted").timer().count());
    }
}
