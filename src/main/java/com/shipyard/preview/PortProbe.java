package com.shipyard.preview;

/**
 * Decides whether a TCP port can currently be bound by a new dev server.
 */
@FunctionalInterface
public interface PortProbe {

    boolean isAvailable(int port);
}
