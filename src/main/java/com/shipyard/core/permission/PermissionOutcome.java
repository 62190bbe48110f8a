package com.shipyard.core.permission;

/**
 * How a permission left the pending registry.
 */
public enum PermissionOutcome {
    APPROVED,
    DENIED,
    /** Nobody decided before the deadline; treated as a denial. */
    EXPIRED;

    public static PermissionOutcome of(boolean approved) {
        return approved ? APPROVED : DENIED;
    }

    public String label() {
        return name().toLowerCase();
    }
}
