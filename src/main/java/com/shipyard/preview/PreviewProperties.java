package com.shipyard.preview;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dev-server preview settings. Port bounds are kept as raw strings so that malformed values
 * fall back to defaults instead of failing startup.
 */
@Component
@ConfigurationProperties(prefix = "shipyard.preview")
public class PreviewProperties {

    private String portStart;
    private String portEnd;

    /** Single-value override, expanded into a full range using the default span. */
    private String preferredPort;

    /** Dev-server command line; {port} is replaced with the allocated port. */
    private String command = "npm run dev -- --port {port}";

    private String projectsRoot = "projects";
    private String host = "localhost";
    private long readinessTimeoutSeconds = 120;
    private long readinessPollMillis = 500;
    private long probeTimeoutMillis = 500;
    private long stopGraceSeconds = 5;

    public String getPortStart() { return portStart; }
    public void setPortStart(String portStart) { this.portStart = portStart; }
    public String getPortEnd() { return portEnd; }
    public void setPortEnd(String portEnd) { this.portEnd = portEnd; }
    public String getPreferredPort() { return preferredPort; }
    public void setPreferredPort(String preferredPort) { this.preferredPort = preferredPort; }
    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public String getProjectsRoot() { return projectsRoot; }
    public void setProjectsRoot(String projectsRoot) { this.projectsRoot = projectsRoot; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public long getReadinessTimeoutSeconds() { return readinessTimeoutSeconds; }
    public void setReadinessTimeoutSeconds(long readinessTimeoutSeconds) { this.readinessTimeoutSeconds = readinessTimeoutSeconds; }
    public long getReadinessPollMillis() { return readinessPollMillis; }
    public void setReadinessPollMillis(long readinessPollMillis) { this.readinessPollMillis = readinessPollMillis; }
    public long getProbeTimeoutMillis() { return probeTimeoutMillis; }
    public void setProbeTimeoutMillis(long probeTimeoutMillis) { this.probeTimeoutMillis = probeTimeoutMillis; }
    public long getStopGraceSeconds() { return stopGraceSeconds; }
    public void setStopGraceSeconds(long stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
}
