package com.shipyard.dispatch.api;

import com.shipyard.core.events.EventHub;
import com.shipyard.core.events.StreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.UUID;

/**
 * Bridges {@link EventHub} subscriptions to HTTP event streams.
 * <p>
 * Each request gets its own emitter wrapped in an {@link EmitterConnection}. The hub sends
 * the acknowledgement and snapshot while subscribing; those writes are buffered by the
 * emitter until the servlet response is ready. Completion, timeout and error of the emitter
 * all unsubscribe the connection, which cancels its heartbeat.
 */
@Service
public class ProjectStreamService {

    private static final Logger log = LoggerFactory.getLogger(ProjectStreamService.class);

    private final EventHub eventHub;
    private final long timeoutMs;

    @Autowired
    public ProjectStreamService(EventHub eventHub, StreamProperties properties) {
        this(eventHub, properties.getEmitterTimeoutMillis());
    }

    ProjectStreamService(EventHub eventHub, long timeoutMs) {
        this.eventHub = eventHub;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Opens a stream for a project. The returned emitter is already completed if the client
     * could not be registered.
     */
    public ResponseBodyEmitter open(String projectId) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(timeoutMs);
        String connectionId = UUID.randomUUID().toString();
        var connection = new EmitterConnection(connectionId, projectId, emitter);

        emitter.onCompletion(() -> {
            log.debug("Stream {} completed for project {}", connectionId, projectId);
            eventHub.unsubscribe(projectId, connectionId);
        });
        emitter.onTimeout(() -> {
            log.debug("Stream {} timed out for project {}", connectionId, projectId);
            eventHub.unsubscribe(projectId, connectionId);
            emitter.complete();
        });
        emitter.onError(ex -> {
            log.debug("Stream {} error for project {}: {}", connectionId, projectId, ex.getMessage());
            eventHub.unsubscribe(projectId, connectionId);
        });

        if (!eventHub.subscribe(projectId, connection)) {
            log.warn("Stream {} for project {} could not be registered", connectionId, projectId);
        } else {
            log.info("Stream {} opened for project {} (timeout={}ms)", connectionId, projectId, timeoutMs);
        }
        return emitter;
    }
}
