package com.shipyard.preview;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link PreviewLauncher} needs to start one dev server.
 */
public record LaunchRequest(
    String projectId,
    Path workingDirectory,
    int port,
    List<String> command,
    Map<String, String> environment
) {

    public LaunchRequest {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
