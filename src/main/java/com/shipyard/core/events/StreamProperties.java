package com.shipyard.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shipyard.stream")
public class StreamProperties {

    /** Interval between heartbeat events on each connection. */
    private long heartbeatSeconds = 30;

    /** Servlet async timeout for an HTTP event stream: 30 minutes. */
    private long emitterTimeoutMillis = 30 * 60 * 1000L;

    public long getHeartbeatSeconds() { return heartbeatSeconds; }
    public void setHeartbeatSeconds(long heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    public long getEmitterTimeoutMillis() { return emitterTimeoutMillis; }
    public void setEmitterTimeoutMillis(long emitterTimeoutMillis) { this.emitterTimeoutMillis = emitterTimeoutMillis; }
}
