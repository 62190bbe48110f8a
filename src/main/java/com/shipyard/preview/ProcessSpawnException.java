package com.shipyard.preview;

/**
 * Thrown when the dev-server process for a preview could not be started.
 */
public class ProcessSpawnException extends RuntimeException {
    public ProcessSpawnException(String message) {
        super(message);
    }

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
