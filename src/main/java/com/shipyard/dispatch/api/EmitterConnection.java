package com.shipyard.dispatch.api;

import com.shipyard.core.events.Connection;
import com.shipyard.core.events.ShipyardEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link Connection} that writes pre-framed event-stream text to a servlet response.
 */
class EmitterConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(EmitterConnection.class);

    static final MediaType FRAME_TYPE = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final String id;
    private final String projectId;
    private final ResponseBodyEmitter emitter;

    EmitterConnection(String id, String projectId, ResponseBodyEmitter emitter) {
        this.id = id;
        this.projectId = projectId;
        this.emitter = emitter;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean send(ShipyardEvent event, String frame) {
        try {
            emitter.send(frame, FRAME_TYPE);
            return true;
        } catch (IOException e) {
            log.debug("Failed to write {} to connection {} of project {}: {}",
                    event.type().wireName(), id, projectId, e.getMessage());
            return false;
        } catch (IllegalStateException e) {
            // Emitter already completed or timed out
            log.debug("Connection {} of project {} no longer writable", id, projectId);
            return false;
        }
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Connection {} already closed", id);
        }
    }
}
