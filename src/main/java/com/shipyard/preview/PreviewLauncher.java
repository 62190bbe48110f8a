package com.shipyard.preview;

import java.util.function.Consumer;

/**
 * Starts dev-server processes. Implementations decide how the command is executed.
 */
public interface PreviewLauncher {

    /**
     * @param output receives each line the process writes to stdout or stderr
     * @throws ProcessSpawnException if the process could not be started
     */
    PreviewProcess launch(LaunchRequest request, Consumer<String> output);
}
