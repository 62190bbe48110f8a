package com.shipyard.core.requests;

/**
 * Whether a project has requests in flight, and how many.
 */
public record TaskStatusSummary(boolean hasActiveRequests, int activeCount) {

    public static TaskStatusSummary of(int activeCount) {
        return new TaskStatusSummary(activeCount > 0, activeCount);
    }
}
