package com.shipyard.preview;

/**
 * Thrown when no port in the scanned range could be bound. Retrying with another range may succeed.
 */
public class PortRangeExhaustedException extends RuntimeException {

    private final PortRange range;

    public PortRangeExhaustedException(PortRange range) {
        super("Unable to find an available port between " + range);
        this.range = range;
    }

    public PortRange getRange() {
        return range;
    }
}
