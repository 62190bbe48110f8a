package com.shipyard.core.events;

import com.shipyard.core.metrics.ShipyardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory, per-project broadcast of {@link ShipyardEvent}s to registered {@link Connection}s.
 * <p>
 * Each project has its own channel. Publishing and subscribing on a channel are serialized by
 * the channel lock, so every connection sees events in publish order and a new connection
 * receives its snapshot strictly before any event published after it registered. Unrelated
 * projects never contend. Removal works on a copy-on-write list and may run concurrently
 * with a broadcast.
 * <p>
 * Delivery is best effort and at most once: a connection whose write fails is dropped on the
 * spot and nothing is buffered for clients that are not connected. Each event is encoded once
 * per publish; an event that cannot be encoded is discarded and no connection is touched.
 * <p>
 * The heartbeat scheduler only triggers beats. The writes run on a separate pool and skip a
 * beat when the project's channel is busy, so a stalled client never delays other projects.
 */
@Service
public class EventHub {

    private static final Logger log = LoggerFactory.getLogger(EventHub.class);

    private static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final ConcurrentHashMap<String, ProjectChannel> channels = new ConcurrentHashMap<>();

    private final Supplier<List<SnapshotContributor>> contributors;
    private final Duration heartbeatInterval;
    private final ShipyardMetrics metrics;

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "stream-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService heartbeatWriters = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stream-heartbeat-writer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public EventHub(ObjectProvider<SnapshotContributor> contributors,
                    StreamProperties properties,
                    @Autowired(required = false) ShipyardMetrics metrics) {
        this(() -> contributors.orderedStream().toList(),
                Duration.ofSeconds(properties.getHeartbeatSeconds()), metrics);
    }

    public EventHub() {
        this(List::of, DEFAULT_HEARTBEAT_INTERVAL, null);
    }

    public EventHub(List<SnapshotContributor> contributors, Duration heartbeatInterval) {
        this(() -> contributors, heartbeatInterval, null);
    }

    EventHub(Supplier<List<SnapshotContributor>> contributors, Duration heartbeatInterval, ShipyardMetrics metrics) {
        this.contributors = contributors;
        this.heartbeatInterval = heartbeatInterval;
        this.metrics = metrics;
        if (metrics != null) {
            metrics.bindConnectionGauge(this::totalConnections);
        }
    }

    /**
     * Registers a connection for a project.
     * <p>
     * Before this method returns the connection has received, in order, a {@code connected}
     * acknowledgement and one event per {@link SnapshotContributor}. It then receives every
     * event published for the project until it is removed, plus a heartbeat at a fixed interval.
     *
     * @return {@code false} if the connection failed while receiving the acknowledgement or
     *         snapshot and was therefore never registered
     */
    public boolean subscribe(String projectId, Connection connection) {
        ProjectChannel channel = channels.computeIfAbsent(projectId, ProjectChannel::new);
        var registration = new Registration(connection);

        channel.lock.lock();
        try {
            Map<String, Object> ack = new LinkedHashMap<>();
            ack.put("projectId", projectId);
            ack.put("timestamp", Instant.now().toString());
            ack.put("transport", connection.transport());
            ack.put("connectionId", connection.id());
            var connected = ShipyardEvent.of(EventType.CONNECTED, projectId, ack);
            if (!writeSafely(connection, connected, EventFrames.encode(connected))) {
                log.warn("Connection {} for project {} failed during handshake", connection.id(), projectId);
                closeQuietly(connection);
                dropped("handshake");
                return false;
            }

            for (SnapshotContributor contributor : contributors.get()) {
                ShipyardEvent snapshot;
                String frame;
                try {
                    snapshot = contributor.snapshot(projectId);
                    if (snapshot == null) {
                        continue;
                    }
                    frame = EventFrames.encode(snapshot);
                } catch (RuntimeException e) {
                    log.warn("Snapshot contributor {} failed for project {}: {}",
                            contributor.getClass().getSimpleName(), projectId, e.getMessage(), e);
                    continue;
                }
                if (!writeSafely(connection, snapshot, frame)) {
                    log.warn("Connection {} for project {} failed during snapshot", connection.id(), projectId);
                    closeQuietly(connection);
                    dropped("snapshot");
                    return false;
                }
            }

            registration.touch();
            channel.connections.add(registration);
        } finally {
            channel.lock.unlock();
        }

        long intervalMs = heartbeatInterval.toMillis();
        registration.attachHeartbeat(heartbeatScheduler.scheduleAtFixedRate(
                () -> triggerHeartbeat(channel, registration),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS));

        log.info("Connection {} added for project {} (connections={})",
                connection.id(), projectId, channel.connections.size());
        return true;
    }

    /**
     * Publishes an event to every live connection of {@code event.projectId()}.
     *
     * @return the number of connections the event was written to
     */
    public int publish(ShipyardEvent event) {
        return publish(event.projectId(), event);
    }

    /**
     * Publishes an event to every live connection of a project. Write failures drop the failing
     * connection and never propagate to the caller. An event whose payload cannot be encoded is
     * logged and delivered to nobody.
     *
     * @return the number of connections the event was written to
     */
    public int publish(String projectId, ShipyardEvent event) {
        ProjectChannel channel = channels.get(projectId);
        if (channel == null || channel.connections.isEmpty()) {
            log.debug("No live connections for project {}; {} not delivered", projectId, event.type().wireName());
            if (metrics != null) {
                metrics.recordEventPublished(event.type().wireName(), 0);
            }
            return 0;
        }

        String frame;
        try {
            frame = EventFrames.encode(event);
        } catch (IllegalArgumentException e) {
            log.warn("Discarding {} for project {}: {}", event.type().wireName(), projectId, e.getMessage());
            if (metrics != null) {
                metrics.recordEventPublished(event.type().wireName(), 0);
            }
            return 0;
        }

        int delivered = 0;
        channel.lock.lock();
        try {
            for (Registration registration : channel.connections) {
                if (writeSafely(registration.connection, event, frame)) {
                    registration.touch();
                    delivered++;
                } else {
                    log.warn("Write of {} to connection {} failed; dropping it from project {}",
                            event.type().wireName(), registration.connection.id(), projectId);
                    remove(channel, registration, "write-failed");
                }
            }
        } finally {
            channel.lock.unlock();
        }

        log.debug("Published {} to {} connection(s) of project {}", event.type().wireName(), delivered, projectId);
        if (metrics != null) {
            metrics.recordEventPublished(event.type().wireName(), delivered);
        }
        return delivered;
    }

    /**
     * Removes a connection and cancels its heartbeat. Safe to call concurrently with
     * {@link #publish} and more than once.
     *
     * @return {@code true} if the connection was registered
     */
    public boolean unsubscribe(String projectId, String connectionId) {
        ProjectChannel channel = channels.get(projectId);
        if (channel == null) {
            return false;
        }
        for (Registration registration : channel.connections) {
            if (registration.connection.id().equals(connectionId)) {
                return remove(channel, registration, "unsubscribed");
            }
        }
        return false;
    }

    /** Closes and removes every connection of a project. */
    public void closeProject(String projectId) {
        ProjectChannel channel = channels.get(projectId);
        if (channel == null) {
            return;
        }
        for (Registration registration : channel.connections) {
            remove(channel, registration, "closed");
        }
        log.info("Closed all connections for project {}", projectId);
    }

    public int connectionCount(String projectId) {
        ProjectChannel channel = channels.get(projectId);
        return channel == null ? 0 : channel.connections.size();
    }

    public int totalConnections() {
        int total = 0;
        for (ProjectChannel channel : channels.values()) {
            total += channel.connections.size();
        }
        return total;
    }

    /**
     * Returns when each live connection of a project last accepted a write, keyed by connection id.
     */
    public Map<String, Instant> lastSeen(String projectId) {
        ProjectChannel channel = channels.get(projectId);
        if (channel == null) {
            return Map.of();
        }
        Map<String, Instant> result = new LinkedHashMap<>();
        for (Registration registration : channel.connections) {
            result.put(registration.connection.id(), registration.lastSeenAt);
        }
        return result;
    }

    @PreDestroy
    public void closeAll() {
        for (String projectId : channels.keySet()) {
            closeProject(projectId);
        }
        heartbeatScheduler.shutdown();
        heartbeatWriters.shutdownNow();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Event hub stopped");
    }

    private void triggerHeartbeat(ProjectChannel channel, Registration registration) {
        if (registration.isRemoved()) {
            registration.cancelHeartbeat();
            return;
        }
        // At most one beat in flight per connection.
        if (!registration.beating.compareAndSet(false, true)) {
            return;
        }
        try {
            heartbeatWriters.execute(() -> {
                try {
                    sendHeartbeat(channel, registration);
                } finally {
                    registration.beating.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            registration.beating.set(false);
            log.debug("Heartbeat writer pool stopped; skipping beat for connection {}", registration.connection.id());
        }
    }

    private void sendHeartbeat(ProjectChannel channel, Registration registration) {
        if (!channel.lock.tryLock()) {
            log.debug("Channel for project {} busy; skipping heartbeat to {}",
                    channel.projectId, registration.connection.id());
            return;
        }
        try {
            if (registration.isRemoved()) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("timestamp", Instant.now().toString());
            data.put("connectionId", registration.connection.id());
            var heartbeat = ShipyardEvent.of(EventType.HEARTBEAT, channel.projectId, data);

            if (writeSafely(registration.connection, heartbeat, EventFrames.encode(heartbeat))) {
                registration.touch();
            } else {
                log.warn("Heartbeat failed for connection {} of project {}; dropping it",
                        registration.connection.id(), channel.projectId);
                remove(channel, registration, "heartbeat-failed");
            }
        } finally {
            channel.lock.unlock();
        }
    }

    private boolean remove(ProjectChannel channel, Registration registration, String reason) {
        registration.cancelHeartbeat();
        if (!channel.connections.remove(registration)) {
            return false;
        }
        closeQuietly(registration.connection);
        dropped(reason);
        log.info("Connection {} removed from project {} ({}; remaining={})",
                registration.connection.id(), channel.projectId, reason, channel.connections.size());
        return true;
    }

    private void dropped(String reason) {
        if (metrics != null) {
            metrics.recordConnectionDropped(reason);
        }
    }

    private static boolean writeSafely(Connection connection, ShipyardEvent event, String frame) {
        try {
            return connection.send(event, frame);
        } catch (RuntimeException e) {
            log.debug("Connection {} threw while sending {}: {}",
                    connection.id(), event.type().wireName(), e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.debug("Closing connection {} failed: {}", connection.id(), e.getMessage());
        }
    }

    private static final class ProjectChannel {
        private final String projectId;
        private final ReentrantLock lock = new ReentrantLock();
        private final CopyOnWriteArrayList<Registration> connections = new CopyOnWriteArrayList<>();

        private ProjectChannel(String projectId) {
            this.projectId = projectId;
        }
    }

    private static final class Registration {
        private final Connection connection;
        private final AtomicBoolean beating = new AtomicBoolean();
        private volatile Instant lastSeenAt;
        private ScheduledFuture<?> heartbeat;
        private boolean removed;

        private Registration(Connection connection) {
            this.connection = connection;
        }

        void touch() {
            lastSeenAt = Instant.now();
        }

        synchronized void attachHeartbeat(ScheduledFuture<?> future) {
            if (removed) {
                future.cancel(false);
            } else {
                heartbeat = future;
            }
        }

        synchronized void cancelHeartbeat() {
            removed = true;
            if (heartbeat != null) {
                heartbeat.cancel(false);
                heartbeat = null;
            }
        }

        synchronized boolean isRemoved() {
            return removed;
        }
    }
}
