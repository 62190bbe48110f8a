package com.shipyard.core.permission;

import com.shipyard.core.metrics.ShipyardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point the execution engine calls before running a tool.
 * <p>
 * Tools the project's {@link PermissionMode} allows are approved immediately; everything else
 * becomes a {@link PendingPermission} in the {@link PermissionBroker} and the returned future
 * completes when a human decides or the deadline passes.
 */
@Service
public class ToolApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ToolApprovalGate.class);

    private final PermissionBroker broker;
    private final PermissionMode defaultMode;
    private final ShipyardMetrics metrics;

    @Autowired
    public ToolApprovalGate(PermissionBroker broker,
                            PermissionProperties properties,
                            @Autowired(required = false) ShipyardMetrics metrics) {
        this(broker, properties.getDefaultMode(), metrics);
    }

    public ToolApprovalGate(PermissionBroker broker, PermissionMode defaultMode, ShipyardMetrics metrics) {
        this.broker = broker;
        this.defaultMode = defaultMode;
        this.metrics = metrics;
    }

    /**
     * @param projectId project the tool runs in
     * @param requestId user request driving the agent; nullable
     * @param toolUseId the engine's id for this tool invocation, used as the permission id
     * @param toolName  tool being invoked
     * @param input     tool input shown to the human
     * @param mode      project policy; {@code null} uses the configured default
     * @return future completing with the decision
     */
    public CompletableFuture<Boolean> requestApproval(String projectId, String requestId, String toolUseId,
                                                      String toolName, Map<String, Object> input,
                                                      PermissionMode mode) {
        PermissionMode effective = mode != null ? mode : defaultMode;
        if (effective.autoApproves(toolName)) {
            log.info("Auto-approved {} for project {} (mode={})", toolName, projectId, effective);
            if (metrics != null) {
                metrics.recordPermissionOutcome("auto");
            }
            return CompletableFuture.completedFuture(true);
        }
        log.info("Asking for approval of {} for project {} (mode={}, permissionId={})",
                toolName, projectId, effective, toolUseId);
        return broker.create(new PermissionRequest(toolUseId, toolName, input, projectId, requestId));
    }
}
