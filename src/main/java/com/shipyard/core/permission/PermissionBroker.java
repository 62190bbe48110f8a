package com.shipyard.core.permission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.core.events.EventHub;
import com.shipyard.core.events.ShipyardEvent;
import com.shipyard.core.logging.MdcContext;
import com.shipyard.core.metrics.ShipyardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of actions waiting for a human approve/deny decision.
 * <p>
 * {@link #create} hands the execution engine a future to suspend on. The future completes
 * exactly once: with the human decision from {@link #resolve}, or with {@code false} when the
 * deadline passes first. Both paths race to remove the entry from the registry and whichever
 * removes it is authoritative; the loser sees "not found".
 */
@Service
public class PermissionBroker {

    private static final Logger log = LoggerFactory.getLogger(PermissionBroker.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PREVIEW_LIMIT = 500;

    private final ConcurrentHashMap<String, Entry> pending = new ConcurrentHashMap<>();
    private final Map<String, PermissionOutcome> finished;

    private final Duration timeout;
    private final EventHub eventHub;
    private final ShipyardMetrics metrics;

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "permission-timeout");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public PermissionBroker(PermissionProperties properties,
                            EventHub eventHub,
                            @Autowired(required = false) ShipyardMetrics metrics) {
        this(Duration.ofSeconds(properties.getTimeoutSeconds()), properties.getRetainedOutcomes(), eventHub, metrics);
    }

    public PermissionBroker(Duration timeout, int retainedOutcomes, EventHub eventHub, ShipyardMetrics metrics) {
        this.timeout = timeout;
        this.eventHub = eventHub;
        this.metrics = metrics;
        this.finished = Collections.synchronizedMap(new LinkedHashMap<String, PermissionOutcome>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PermissionOutcome> eldest) {
                return size() > retainedOutcomes;
            }
        });
    }

    /**
     * Registers a pending permission without project scope.
     *
     * @return a future completing with {@code true} (approved) or {@code false} (denied or timed out)
     */
    public CompletableFuture<Boolean> create(String id, String kind, Map<String, Object> payload) {
        return create(new PermissionRequest(id, kind, payload, null, null));
    }

    /**
     * Registers a pending permission and starts its deadline.
     *
     * @return a future completing with {@code true} (approved) or {@code false} (denied or timed out)
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<Boolean> create(PermissionRequest request) {
        Instant now = Instant.now();
        var entry = new Entry(request, now, now.plus(timeout));
        if (pending.putIfAbsent(request.id(), entry) != null) {
            throw new IllegalStateException("Permission " + request.id() + " is already pending");
        }
        finished.remove(request.id());
        entry.attachTimeout(timer.schedule(() -> expire(entry), timeout.toMillis(), TimeUnit.MILLISECONDS));

        MdcContext.setPermission(request.projectId(), request.id());
        try {
            log.info("Permission {} pending for {} (timeout={}s)", request.id(), request.kind(), timeout.toSeconds());
            if (request.projectId() != null) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("permissionId", request.id());
                metadata.put("toolName", request.kind());
                metadata.put("inputPreview", entry.inputPreview);
                metadata.put("expiresAt", entry.expiresAt.toString());
                publish(request, "permission_requested", metadata);
            }
        } finally {
            MdcContext.clear();
        }
        return entry.outcome;
    }

    /**
     * Applies a human decision.
     *
     * @return {@code true} if this call resolved the permission; {@code false} if the id is unknown,
     *         was already resolved, or already timed out
     */
    public boolean resolve(String id, boolean approved) {
        Entry entry = id == null ? null : pending.remove(id);
        if (entry == null) {
            log.debug("Permission {} not pending (outcome={})", id, id == null ? null : finished.get(id));
            return false;
        }
        entry.cancelTimeout();
        PermissionOutcome outcome = PermissionOutcome.of(approved);
        finished.put(id, outcome);
        entry.outcome.complete(approved);

        MdcContext.setPermission(entry.request.projectId(), id);
        try {
            log.info("Permission {} resolved -> {}", id, outcome.label());
            if (metrics != null) {
                metrics.recordPermissionOutcome(outcome.label());
            }
            if (entry.request.projectId() != null) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("permissionId", id);
                metadata.put("approved", approved);
                metadata.put("toolName", entry.request.kind());
                publish(entry.request, "permission_resolved", metadata);
            }
        } finally {
            MdcContext.clear();
        }
        return true;
    }

    /** Snapshot of every pending permission, oldest first. */
    public List<PendingPermission> list() {
        return pending.values().stream()
                .sorted(Comparator.comparing((Entry e) -> e.createdAt))
                .map(Entry::view)
                .toList();
    }

    /** Snapshot of the pending permissions of one project, oldest first. */
    public List<PendingPermission> list(String projectId) {
        return pending.values().stream()
                .filter(e -> projectId.equals(e.request.projectId()))
                .sorted(Comparator.comparing((Entry e) -> e.createdAt))
                .map(Entry::view)
                .toList();
    }

    public Optional<PendingPermission> find(String id) {
        Entry entry = pending.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.view());
    }

    /**
     * How a recently finished permission ended. Empty for pending and unknown ids, and for ids
     * that have aged out of the retained window.
     */
    public Optional<PermissionOutcome> outcomeOf(String id) {
        return Optional.ofNullable(finished.get(id));
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Denies everything still pending and stops the deadline timer. */
    @PreDestroy
    public void shutdown() {
        for (String id : List.copyOf(pending.keySet())) {
            Entry entry = pending.remove(id);
            if (entry != null) {
                entry.cancelTimeout();
                finished.put(id, PermissionOutcome.DENIED);
                entry.outcome.complete(false);
            }
        }
        timer.shutdownNow();
        log.info("Permission broker stopped");
    }

    private void expire(Entry entry) {
        String id = entry.request.id();
        if (!pending.remove(id, entry)) {
            return;
        }
        finished.put(id, PermissionOutcome.EXPIRED);
        entry.outcome.complete(false);

        MdcContext.setPermission(entry.request.projectId(), id);
        try {
            log.info("Permission {} timed out after {}s; denying", id, timeout.toSeconds());
            if (metrics != null) {
                metrics.recordPermissionOutcome(PermissionOutcome.EXPIRED.label());
            }
            if (entry.request.projectId() != null) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("permissionId", id);
                metadata.put("toolName", entry.request.kind());
                publish(entry.request, "permission_expired", metadata);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void publish(PermissionRequest request, String status, Map<String, Object> metadata) {
        if (eventHub == null) {
            return;
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        if (request.requestId() != null) {
            extra.put("requestId", request.requestId());
        }
        extra.put("metadata", metadata);
        eventHub.publish(ShipyardEvent.status(request.projectId(), status, extra));
    }

    static String inputPreview(Map<String, Object> payload) {
        try {
            String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
            return json.length() > PREVIEW_LIMIT ? json.substring(0, PREVIEW_LIMIT) + "..." : json;
        } catch (JsonProcessingException e) {
            return "[Unable to serialize input]";
        }
    }

    private static final class Entry {
        private final PermissionRequest request;
        private final Instant createdAt;
        private final Instant expiresAt;
        private final String inputPreview;
        private final CompletableFuture<Boolean> outcome = new CompletableFuture<>();
        private ScheduledFuture<?> timeoutHandle;

        private Entry(PermissionRequest request, Instant createdAt, Instant expiresAt) {
            this.request = request;
            this.createdAt = createdAt;
            this.expiresAt = expiresAt;
            this.inputPreview = inputPreview(request.payload());
        }

        synchronized void attachTimeout(ScheduledFuture<?> handle) {
            if (outcome.isDone()) {
                handle.cancel(false);
            } else {
                timeoutHandle = handle;
            }
        }

        synchronized void cancelTimeout() {
            if (timeoutHandle != null) {
                timeoutHandle.cancel(false);
                timeoutHandle = null;
            }
        }

        PendingPermission view() {
            return new PendingPermission(request.id(), request.kind(), request.payload(),
                    request.projectId(), request.requestId(), inputPreview, createdAt, expiresAt);
        }
    }
}
