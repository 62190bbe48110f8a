package com.shipyard.preview;

/**
 * Inclusive TCP port range scanned by the {@link PortAllocator}.
 */
public record PortRange(int start, int end) {

    public PortRange {
        if (end < start) {
            throw new InvalidPortRangeException(
                    "Unable to determine a valid port range (start " + start + ", end " + end + ")");
        }
    }

    public int size() {
        return end - start + 1;
    }

    public boolean contains(int port) {
        return port >= start && port <= end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
