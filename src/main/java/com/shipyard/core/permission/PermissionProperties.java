package com.shipyard.core.permission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shipyard.permissions")
public class PermissionProperties {

    /** How long a request waits for a human before it is denied. */
    private long timeoutSeconds = 60;

    /** How many finished ids are remembered to tell "already resolved" apart from "unknown". */
    private int retainedOutcomes = 500;

    private PermissionMode defaultMode = PermissionMode.DEFAULT;

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getRetainedOutcomes() { return retainedOutcomes; }
    public void setRetainedOutcomes(int retainedOutcomes) { this.retainedOutcomes = retainedOutcomes; }
    public PermissionMode getDefaultMode() { return defaultMode; }
    public void setDefaultMode(PermissionMode defaultMode) { this.defaultMode = defaultMode; }
}
