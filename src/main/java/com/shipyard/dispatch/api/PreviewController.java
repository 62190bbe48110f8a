package com.shipyard.dispatch.api;

import com.shipyard.core.logging.MdcContext;
import com.shipyard.preview.InvalidPortRangeException;
import com.shipyard.preview.PortRangeExhaustedException;
import com.shipyard.preview.PreviewInstance;
import com.shipyard.preview.PreviewManager;
import com.shipyard.preview.PreviewStatus;
import com.shipyard.preview.ProcessSpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for a project's dev-server preview.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/preview")
public class PreviewController {

    private static final Logger log = LoggerFactory.getLogger(PreviewController.class);

    private final PreviewManager previewManager;

    public PreviewController(PreviewManager previewManager) {
        this.previewManager = previewManager;
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String projectId) {
        MdcContext.setProject(projectId);
        try {
            PreviewInstance instance = previewManager.start(projectId);
            return ResponseEntity.ok(success(instance));
        } catch (InvalidPortRangeException e) {
            return failure(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (PortRangeExhaustedException e) {
            return failure(HttpStatus.CONFLICT, e.getMessage());
        } catch (ProcessSpawnException e) {
            log.error("Failed to start preview for project {}", projectId, e);
            return failure(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String projectId) {
        MdcContext.setProject(projectId);
        try {
            return ResponseEntity.ok(success(previewManager.stop(projectId)));
        } finally {
            MdcContext.clear();
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String projectId) {
        PreviewStatus status = previewManager.getStatus(projectId);
        return ResponseEntity.ok(success(status));
    }

    private static Map<String, Object> success(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", data);
        return body;
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
