package com.shipyard.preview;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running dev-server process.
 */
public interface PreviewProcess {

    long pid();

    boolean isAlive();

    /** Completes with the exit code once the process has terminated. */
    CompletableFuture<Integer> onExit();

    /**
     * Terminates the process and its descendants, forcibly once {@code grace} has elapsed.
     * Calling this on a process that already exited does nothing.
     */
    void destroy(Duration grace);
}
