package com.shipyard.preview;

import java.time.Instant;

/**
 * Descriptor of a supervised dev-server process. Repeated {@code start} calls for a live
 * preview return an equal descriptor.
 */
public record PreviewInstance(
    String projectId,
    int port,
    String url,
    long pid,
    Instant startedAt
) {}
