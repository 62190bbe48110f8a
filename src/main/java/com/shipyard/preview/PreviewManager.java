package com.shipyard.preview;

import com.shipyard.core.events.EventHub;
import com.shipyard.core.events.EventType;
import com.shipyard.core.events.ShipyardEvent;
import com.shipyard.core.events.SnapshotContributor;
import com.shipyard.core.metrics.ShipyardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervises one dev-server process per project.
 *
 * <p>Lifecycle: {@code start} allocates a port, launches the process and moves the preview to
 * STARTING, then RUNNING once the process is alive. A background poll moves it to READY when
 * the server accepts connections, or to ERROR when it does not within the readiness timeout.
 * An exit that was not requested through {@link #stop} moves it to ERROR. Crashed previews
 * are never restarted automatically.
 *
 * <p>Start and stop on one project are serialized by a per-project lock; different projects
 * never contend. Every transition is published as a {@code preview_status} event.
 */
@Service
@Order(10)
public class PreviewManager implements SnapshotContributor {

    private static final Logger log = LoggerFactory.getLogger(PreviewManager.class);

    private final PreviewLauncher launcher;
    private final PortAllocator portAllocator;
    private final ReadinessProbe readinessProbe;
    private final EventHub eventHub;
    private final PreviewProperties properties;
    private final ShipyardMetrics metrics;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Supervised> previews = new ConcurrentHashMap<>();
    private final Set<Integer> reservedPorts = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService monitor = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "preview-monitor");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public PreviewManager(PreviewLauncher launcher,
                          PortAllocator portAllocator,
                          ReadinessProbe readinessProbe,
                          EventHub eventHub,
                          PreviewProperties properties,
                          @Autowired(required = false) ShipyardMetrics metrics) {
        this.launcher = launcher;
        this.portAllocator = portAllocator;
        this.readinessProbe = readinessProbe;
        this.eventHub = eventHub;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Starts the project's dev server, or returns the live one.
     *
     * @throws InvalidPortRangeException   if the configured port bounds are unusable
     * @throws PortRangeExhaustedException if every port in the range is taken
     * @throws ProcessSpawnException       if the process could not be launched; launcher failures of
     *                                     any other type are wrapped in it
     */
    public PreviewInstance start(String projectId) {
        ReentrantLock lock = lockFor(projectId);
        lock.lock();
        try {
            Supervised current = previews.get(projectId);
            if (current != null && current.state.isActive()) {
                log.info("Preview for project {} already {} on port {}",
                        projectId, current.state.wireName(), current.instance.port());
                return current.instance;
            }

            Path workingDirectory = workingDirectoryFor(projectId);
            int port = reservePort();
            String url = urlFor(port);

            PreviewProcess process;
            try {
                process = launcher.launch(
                        new LaunchRequest(projectId, workingDirectory, port, commandFor(port),
                                Map.of("PORT", String.valueOf(port))),
                        line -> publishOutput(projectId, line));
            } catch (RuntimeException e) {
                reservedPorts.remove(port);
                ProcessSpawnException failure = e instanceof ProcessSpawnException spawn ? spawn
                        : new ProcessSpawnException("Failed to start dev server for project " + projectId
                                + ": " + e.getMessage(), e);
                var failed = new Supervised(new PreviewInstance(projectId, port, url, -1, Instant.now()), null);
                previews.put(projectId, failed);
                fail(failed, failure.getMessage(), "spawn");
                throw failure;
            }

            var supervised = new Supervised(
                    new PreviewInstance(projectId, port, url, process.pid(), Instant.now()), process);
            previews.put(projectId, supervised);
            if (metrics != null) {
                metrics.recordPreviewStart();
            }
            transition(supervised, PreviewState.STARTING, "Starting dev server on port " + port);
            watch(supervised);
            return supervised.instance;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the project's dev server. Stopping a preview that is not running is a no-op.
     */
    public PreviewStatus stop(String projectId) {
        ReentrantLock lock = lockFor(projectId);
        lock.lock();
        try {
            Supervised supervised = previews.get(projectId);
            if (supervised == null) {
                log.debug("No preview to stop for project {}", projectId);
                return PreviewStatus.idle(projectId);
            }
            if (supervised.state == PreviewState.STOPPED) {
                return supervised.status();
            }
            supervised.stopping = true;
            supervised.cancelReadiness();
            if (supervised.process != null) {
                supervised.process.destroy(Duration.ofSeconds(properties.getStopGraceSeconds()));
            }
            release(supervised);
            transition(supervised, PreviewState.STOPPED, "Preview stopped");
            log.info("Stopped preview for project {} (pid {})", projectId, supervised.instance.pid());
            return supervised.status();
        } finally {
            lock.unlock();
        }
    }

    public PreviewStatus getStatus(String projectId) {
        Supervised supervised = previews.get(projectId);
        return supervised == null ? PreviewStatus.idle(projectId) : supervised.status();
    }

    /**
     * The live instance for a project, if its preview is starting, running or ready.
     */
    public Optional<PreviewInstance> getInstance(String projectId) {
        Supervised supervised = previews.get(projectId);
        if (supervised == null || !supervised.state.isActive()) {
            return Optional.empty();
        }
        return Optional.of(supervised.instance);
    }

    public int activeCount() {
        return (int) previews.values().stream().filter(s -> s.state.isActive()).count();
    }

    @Override
    public ShipyardEvent snapshot(String projectId) {
        Supervised supervised = previews.get(projectId);
        if (supervised == null) {
            return ShipyardEvent.of(EventType.PREVIEW_STATUS, projectId, Map.of("status", "stopped"));
        }
        return ShipyardEvent.of(EventType.PREVIEW_STATUS, projectId, supervised.status().toEventData());
    }

    @PreDestroy
    public void stopAll() {
        for (String projectId : List.copyOf(previews.keySet())) {
            try {
                stop(projectId);
            } catch (RuntimeException e) {
                log.warn("Failed to stop preview for project {}: {}", projectId, e.getMessage());
            }
        }
        monitor.shutdownNow();
    }

    private void watch(Supervised supervised) {
        PreviewProcess process = supervised.process;
        if (process.isAlive()) {
            transition(supervised, PreviewState.RUNNING, "Dev server process running (pid " + process.pid() + ")");
        }
        process.onExit().whenCompleteAsync((code, error) -> onExit(supervised, code), monitor);

        long pollMillis = properties.getReadinessPollMillis();
        Instant deadline = Instant.now().plusSeconds(properties.getReadinessTimeoutSeconds());
        supervised.readinessTask = monitor.scheduleWithFixedDelay(
                () -> checkReadiness(supervised, deadline), pollMillis, pollMillis, TimeUnit.MILLISECONDS);
    }

    private void checkReadiness(Supervised supervised, Instant deadline) {
        try {
            if (supervised.state != PreviewState.STARTING && supervised.state != PreviewState.RUNNING) {
                supervised.cancelReadiness();
                return;
            }
            boolean ready = readinessProbe.isReady(supervised.instance.port());
            withCurrent(supervised, () -> {
                if (ready) {
                    supervised.cancelReadiness();
                    transition(supervised, PreviewState.READY, "Dev server ready at " + supervised.instance.url());
                } else if (Instant.now().isAfter(deadline)) {
                    supervised.stopping = true;
                    supervised.cancelReadiness();
                    supervised.process.destroy(Duration.ofSeconds(properties.getStopGraceSeconds()));
                    release(supervised);
                    fail(supervised, "Dev server did not become ready within "
                            + properties.getReadinessTimeoutSeconds() + "s", "readiness-timeout");
                }
            });
        } catch (RuntimeException e) {
            log.warn("Readiness check failed for project {}: {}", supervised.instance.projectId(), e.getMessage());
        }
    }

    private void onExit(Supervised supervised, Integer exitCode) {
        release(supervised);
        withCurrent(supervised, () -> {
            supervised.cancelReadiness();
            if (supervised.stopping) {
                return;
            }
            log.warn("Dev server for project {} exited unexpectedly with code {}",
                    supervised.instance.projectId(), exitCode);
            fail(supervised, "Dev server exited unexpectedly (exit code " + exitCode + ")", "crash");
        });
    }

    /**
     * Runs {@code action} under the project lock if {@code supervised} is still the project's
     * current, active preview.
     */
    private void withCurrent(Supervised supervised, Runnable action) {
        String projectId = supervised.instance.projectId();
        ReentrantLock lock = lockFor(projectId);
        lock.lock();
        try {
            if (previews.get(projectId) == supervised && supervised.state.isActive()) {
                action.run();
            }
        } finally {
            lock.unlock();
        }
    }

    private void fail(Supervised supervised, String message, String reason) {
        transition(supervised, PreviewState.ERROR, message);
        eventHub.publish(ShipyardEvent.error(supervised.instance.projectId(), message));
        if (metrics != null) {
            metrics.recordPreviewFailure(reason);
        }
    }

    private void transition(Supervised supervised, PreviewState state, String message) {
        supervised.state = state;
        supervised.message = message;
        String projectId = supervised.instance.projectId();
        log.info("Preview for project {} -> {}: {}", projectId, state.wireName(), message);
        eventHub.publish(ShipyardEvent.of(EventType.PREVIEW_STATUS, projectId, supervised.status().toEventData()));
    }

    private void publishOutput(String projectId, String line) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", "info");
        data.put("content", line);
        data.put("source", "preview");
        data.put("projectId", projectId);
        data.put("timestamp", Instant.now().toString());
        eventHub.publish(ShipyardEvent.of(EventType.LOG, projectId, data));
    }

    private int reservePort() {
        PortRange range = portAllocator.defaultRange();
        while (true) {
            int port = portAllocator.allocate(range, Set.copyOf(reservedPorts));
            if (reservedPorts.add(port)) {
                return port;
            }
        }
    }

    private void release(Supervised supervised) {
        if (supervised.releasePort()) {
            reservedPorts.remove(supervised.instance.port());
        }
    }

    private Path workingDirectoryFor(String projectId) {
        Path root = Path.of(properties.getProjectsRoot()).toAbsolutePath().normalize();
        Path dir = root.resolve(projectId).normalize();
        if (!dir.startsWith(root) || dir.equals(root)) {
            throw new ProcessSpawnException("Invalid project id: " + projectId);
        }
        return dir;
    }

    List<String> commandFor(int port) {
        String portText = String.valueOf(port);
        return Arrays.stream(properties.getCommand().trim().split("\\s+"))
                .map(part -> part.replace("{port}", portText))
                .toList();
    }

    private String urlFor(int port) {
        return "http://" + properties.getHost() + ":" + port;
    }

    private ReentrantLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, id -> new ReentrantLock());
    }

    private static final class Supervised {
        final PreviewInstance instance;
        final PreviewProcess process;
        volatile PreviewState state = PreviewState.IDLE;
        volatile String message;
        volatile boolean stopping;
        volatile ScheduledFuture<?> readinessTask;
        private boolean portHeld;

        Supervised(PreviewInstance instance, PreviewProcess process) {
            this.instance = instance;
            this.process = process;
            this.portHeld = process != null;
        }

        synchronized boolean releasePort() {
            boolean held = portHeld;
            portHeld = false;
            return held;
        }

        synchronized void cancelReadiness() {
            if (readinessTask != null) {
                readinessTask.cancel(false);
            }
        }

        PreviewStatus status() {
            boolean holdsPort = state.isActive();
            return new PreviewStatus(instance.projectId(), state,
                    holdsPort ? instance.port() : null,
                    holdsPort ? instance.url() : null,
                    message);
        }
    }
}
