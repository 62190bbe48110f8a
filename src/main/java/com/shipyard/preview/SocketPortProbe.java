package com.shipyard.preview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes a port by binding a listener on each of the four addresses a dev server may use.
 * <p>
 * A port is accepted when both IPv4 binds succeed. The IPv6 outcomes are collected for
 * diagnostics only, because hosts without IPv6 (or with dual-stack quirks) report spurious
 * failures there. Each bind is a separate attempt bounded by its own timeout; a timed-out
 * attempt counts as a failure. Attempts run one after another so that the probe's own
 * listeners never contend for the port.
 */
public class SocketPortProbe implements PortProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SocketPortProbe.class);

    public enum BindTarget {
        IPV4_WILDCARD("0.0.0.0"),
        IPV6_WILDCARD("::"),
        IPV4_LOOPBACK("127.0.0.1"),
        IPV6_LOOPBACK("::1");

        private final String host;

        BindTarget(String host) {
            this.host = host;
        }

        public String host() {
            return host;
        }
    }

    /**
     * Outcome of probing one port.
     */
    public record ProbeResult(int port, Map<BindTarget, Boolean> outcomes) {

        public ProbeResult {
            outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
        }

        public boolean succeeded(BindTarget target) {
            return Boolean.TRUE.equals(outcomes.get(target));
        }

        public boolean accepted() {
            return succeeded(BindTarget.IPV4_WILDCARD) && succeeded(BindTarget.IPV4_LOOPBACK);
        }
    }

    private final Duration attemptTimeout;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "port-probe");
        t.setDaemon(true);
        return t;
    });

    public SocketPortProbe(Duration attemptTimeout) {
        this.attemptTimeout = attemptTimeout;
    }

    @Override
    public boolean isAvailable(int port) {
        return probe(port).accepted();
    }

    public ProbeResult probe(int port) {
        Map<BindTarget, Boolean> outcomes = new EnumMap<>(BindTarget.class);
        for (BindTarget target : BindTarget.values()) {
            outcomes.put(target, attempt(target, port));
        }
        log.debug("Port {} probe: {}", port, outcomes);
        return new ProbeResult(port, outcomes);
    }

    private boolean attempt(BindTarget target, int port) {
        CompletableFuture<Boolean> bind = CompletableFuture.supplyAsync(() -> tryBind(target, port), executor);
        try {
            return bind.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            bind.cancel(true);
            log.debug("Bind {}:{} timed out after {}ms", target.host(), port, attemptTimeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.debug("Bind {}:{} failed: {}", target.host(), port, e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean tryBind(BindTarget target, int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getByName(target.host()), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
