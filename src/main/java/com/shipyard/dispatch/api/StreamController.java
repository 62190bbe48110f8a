package com.shipyard.dispatch.api;

import com.shipyard.core.logging.MdcContext;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Long-lived event stream per project.
 */
@RestController
public class StreamController {

    private final ProjectStreamService streamService;

    public StreamController(ProjectStreamService streamService) {
        this.streamService = streamService;
    }

    /**
     * GET /api/chat/{projectId}/stream: {@code data: <json>} frames until the client disconnects.
     */
    @GetMapping("/api/chat/{projectId}/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(@PathVariable String projectId) {
        MdcContext.setProject(projectId);
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_EVENT_STREAM)
                    .cacheControl(CacheControl.noCache().noTransform())
                    .header("X-Accel-Buffering", "no")
                    .body(streamService.open(projectId));
        } finally {
            MdcContext.clear();
        }
    }
}
