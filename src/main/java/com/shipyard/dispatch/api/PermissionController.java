package com.shipyard.dispatch.api;

import com.shipyard.core.logging.MdcContext;
import com.shipyard.core.permission.PendingPermission;
import com.shipyard.core.permission.PermissionBroker;
import com.shipyard.core.permission.PermissionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller through which a human approves or denies pending tool permissions.
 */
@RestController
@RequestMapping("/api/permissions")
public class PermissionController {

    private static final Logger log = LoggerFactory.getLogger(PermissionController.class);

    private final PermissionBroker permissionBroker;

    public PermissionController(PermissionBroker permissionBroker) {
        this.permissionBroker = permissionBroker;
    }

    /**
     * POST /api/permissions/confirm with {@code {"permissionId": "...", "approved": true}}.
     * The body is read as a map so that a non-boolean {@code approved} is reported as 400
     * instead of being coerced.
     */
    @PostMapping("/confirm")
    public ResponseEntity<Map<String, Object>> confirm(@RequestBody(required = false) Map<String, Object> body) {
        Object rawId = body == null ? null : body.get("permissionId");
        Object rawApproved = body == null ? null : body.get("approved");

        if (!(rawId instanceof String permissionId) || permissionId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "permissionId is required"));
        }
        if (!(rawApproved instanceof Boolean approved)) {
            return ResponseEntity.badRequest().body(Map.of("error", "approved must be a boolean"));
        }

        Optional<PendingPermission> pending = permissionBroker.find(permissionId);
        if (pending.isEmpty()) {
            return notPending(permissionId);
        }

        MdcContext.setPermission(pending.get().projectId(), permissionId);
        try {
            if (!permissionBroker.resolve(permissionId, approved)) {
                // Lost the race to the deadline timer or another confirm.
                return notPending(permissionId);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("permissionId", permissionId);
            result.put("status", PermissionOutcome.of(approved).label());
            return ResponseEntity.ok(result);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * GET /api/permissions/pending, optionally filtered by {@code projectId}.
     */
    @GetMapping("/pending")
    public ResponseEntity<List<PendingPermission>> pending(@RequestParam(required = false) String projectId) {
        return ResponseEntity.ok(projectId == null || projectId.isBlank()
                ? permissionBroker.list()
                : permissionBroker.list(projectId));
    }

    private ResponseEntity<Map<String, Object>> notPending(String permissionId) {
        Optional<PermissionOutcome> outcome = permissionBroker.outcomeOf(permissionId);
        if (outcome.isPresent()) {
            log.info("Permission {} already {}", permissionId, outcome.get().label());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Permission request already " + outcome.get().label(),
                    "permissionId", permissionId));
        }
        return ResponseEntity.status(404).body(Map.of(
                "error", "Permission request not found",
                "permissionId", permissionId));
    }
}
