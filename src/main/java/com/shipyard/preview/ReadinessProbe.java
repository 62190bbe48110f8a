package com.shipyard.preview;

@FunctionalInterface
public interface ReadinessProbe {

    boolean isReady(int port);
}
