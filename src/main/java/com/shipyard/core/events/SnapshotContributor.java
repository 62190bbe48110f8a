package com.shipyard.core.events;

/**
 * Supplies one piece of current state sent to a connection right after it subscribes,
 * so a client that connects between two publishes still learns where things stand.
 * <p>
 * Contributors are invoked in {@link org.springframework.core.annotation.Order} order.
 */
@FunctionalInterface
public interface SnapshotContributor {

    /**
     * @param projectId the project being subscribed to
     * @return the snapshot event, or {@code null} to contribute nothing
     */
    ShipyardEvent snapshot(String projectId);
}
