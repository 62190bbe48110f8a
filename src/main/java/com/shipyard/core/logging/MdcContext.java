package com.shipyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Shipyard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        if (projectId != null) {
            MDC.put("projectId", projectId);
        }
    }

    public static void setPermission(String projectId, String permissionId) {
        setProject(projectId);
        MDC.put("permissionId", permissionId);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("permissionId");
    }
}
