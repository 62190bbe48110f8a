package com.shipyard.preview;

import com.shipyard.core.metrics.ShipyardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Finds a free TCP port for a preview dev server by scanning a range from its low end.
 * <p>
 * Allocation only checks availability; nothing is held afterwards, so a port can be taken
 * by someone else before the dev server binds it. Callers that run several previews keep
 * their own set of reserved ports and pass it as {@code excluded}.
 */
@Service
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    public static final int MAX_PORT = 65_535;
    public static final int FALLBACK_PORT_START = 3_135;
    public static final int FALLBACK_PORT_END = 3_999;
    public static final int DEFAULT_RANGE_SPAN = FALLBACK_PORT_END - FALLBACK_PORT_START;

    private final PortProbe probe;
    private final Integer preferredPort;
    private final int defaultStart;
    private final int defaultEnd;
    private final ShipyardMetrics metrics;

    @Autowired
    public PortAllocator(PortProbe probe, PreviewProperties properties,
                         @Autowired(required = false) ShipyardMetrics metrics) {
        this(probe, properties.getPortStart(), properties.getPortEnd(), properties.getPreferredPort(), metrics);
    }

    public PortAllocator(PortProbe probe, String configuredStart, String configuredEnd,
                         String configuredPreferred, ShipyardMetrics metrics) {
        this.probe = probe;
        this.metrics = metrics;
        this.preferredPort = normalize(configuredPreferred);

        Integer start = normalize(configuredStart);
        this.defaultStart = start != null ? start : FALLBACK_PORT_START;
        Integer end = normalize(configuredEnd);
        this.defaultEnd = end != null && end >= defaultStart ? end : spanFrom(defaultStart);
    }

    /**
     * Parses a port bound. Anything that is not an integer in 1..65535 is treated as absent.
     */
    public static Integer normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i > 0 && i <= MAX_PORT ? i : null;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            int port = Integer.parseInt(text);
            return port > 0 && port <= MAX_PORT ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public PortRange defaultRange() {
        return resolveRange(null, null);
    }

    public PortRange resolveRange(Object start, Object end) {
        Integer explicitStart = normalize(start);
        Integer explicitEnd = normalize(end);

        int rangeStart;
        int rangeEnd;
        if (explicitStart != null) {
            rangeStart = explicitStart;
            rangeEnd = explicitEnd != null ? explicitEnd : spanFrom(explicitStart);
        } else if (preferredPort != null) {
            rangeStart = preferredPort;
            rangeEnd = explicitEnd != null ? explicitEnd : spanFrom(preferredPort);
        } else {
            rangeStart = defaultStart;
            rangeEnd = explicitEnd != null ? explicitEnd : defaultEnd;
        }
        return new PortRange(rangeStart, rangeEnd);
    }

    public int allocate() {
        return allocate(defaultRange(), Set.of());
    }

    public int allocate(Integer start, Integer end) {
        return allocate(resolveRange(start, end), Set.of());
    }

    public int allocate(PortRange range, Set<Integer> excluded) {
        long startNanos = System.nanoTime();
        for (int port = range.start(); port <= range.end(); port++) {
            if (excluded.contains(port)) {
                continue;
            }
            if (probe.isAvailable(port)) {
                record(startNanos, true);
                log.info("Allocated port {} from range {}", port, range);
                return port;
            }
        }
        record(startNanos, false);
        log.warn("No available port in range {}", range);
        throw new PortRangeExhaustedException(range);
    }

    /**
     * True when at least one port in the default range currently passes the probe.
     */
    public boolean hasFreePort() {
        PortRange range = defaultRange();
        for (int port = range.start(); port <= range.end(); port++) {
            if (probe.isAvailable(port)) {
                return true;
            }
        }
        return false;
    }

    private static int spanFrom(int start) {
        return Math.min(start + DEFAULT_RANGE_SPAN, MAX_PORT);
    }

    private void record(long startNanos, boolean found) {
        if (metrics != null) {
            metrics.recordPortAllocation((System.nanoTime() - startNanos) / 1_000_000, found);
        }
    }
}
