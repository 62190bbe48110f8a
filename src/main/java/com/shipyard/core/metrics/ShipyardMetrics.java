package com.shipyard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for event streaming, permissions and previews.
 */
@Service
public class ShipyardMetrics {

    private final MeterRegistry registry;

    public ShipyardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void bindConnectionGauge(Supplier<Number> liveConnections) {
        Gauge.builder("shipyard.stream.connections", liveConnections)
                .description("Live event stream connections across all projects")
                .register(registry);
    }

    public void recordEventPublished(String eventType, int delivered) {
        Counter.builder("shipyard.stream.events.published")
                .tag("type", eventType)
                .register(registry)
                .increment();
        Counter.builder("shipyard.stream.events.delivered")
                .tag("type", eventType)
                .register(registry)
                .increment(delivered);
    }

    public void recordConnectionDropped(String reason) {
        Counter.builder("shipyard.stream.connections.dropped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome one of approved, denied, expired, auto
     */
    public void recordPermissionOutcome(String outcome) {
        Counter.builder("shipyard.permissions.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPortAllocation(long ms, boolean found) {
        Timer.builder("shipyard.preview.port.allocation")
                .tag("result", found ? "found" : "exhausted")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPreviewStart() {
        Counter.builder("shipyard.preview.starts")
                .register(registry)
                .increment();
    }

    public void recordPreviewFailure(String reason) {
        Counter.builder("shipyard.preview.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
