package com.shipyard.preview;

/**
 * Thrown when configured or requested port bounds resolve to an empty range.
 */
public class InvalidPortRangeException extends RuntimeException {
    public InvalidPortRangeException(String message) {
        super(message);
    }
}
