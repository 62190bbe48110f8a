package com.shipyard.dispatch.api;

import com.shipyard.core.permission.PendingPermission;
import com.shipyard.core.permission.PermissionBroker;
import com.shipyard.core.permission.PermissionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PermissionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PermissionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PermissionBroker permissionBroker;

    private static PendingPermission pending(String id, String projectId) {
        Instant now = Instant.now();
        return new PendingPermission(id, "Bash", Map.of("command", "ls"), projectId, "r1",
                "{\"command\":\"ls\"}", now, now.plusSeconds(60));
    }

    // ── POST /api/permissions/confirm ────────────────────────────────

    @Test
    @DisplayName("approving a pending permission returns its status")
    void approves() throws Exception {
        when(permissionBroker.find("perm-1")).thenReturn(Optional.of(pending("perm-1", "P1")));
        when(permissionBroker.resolve("perm-1", true)).thenReturn(true);

        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"perm-1\",\"approved\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permissionId").value("perm-1"))
                .andExpect(jsonPath("$.status").value("approved"));
    }

    @Test
    @DisplayName("denying returns denied")
    void denies() throws Exception {
        when(permissionBroker.find("perm-1")).thenReturn(Optional.of(pending("perm-1", "P1")));
        when(permissionBroker.resolve("perm-1", false)).thenReturn(true);

        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"perm-1\",\"approved\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("denied"));
    }

    @Test
    @DisplayName("missing permissionId is a bad request")
    void missingId() throws Exception {
        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("permissionId")));

        verify(permissionBroker, never()).resolve(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("non-boolean approved is a bad request")
    void nonBooleanApproved() throws Exception {
        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"perm-1\",\"approved\":\"yes\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("boolean")));
    }

    @Test
    @DisplayName("unknown ids are not found")
    void unknownId() throws Exception {
        when(permissionBroker.find("ghost")).thenReturn(Optional.empty());
        when(permissionBroker.outcomeOf("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"ghost\",\"approved\":true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("an expired permission is reported as already resolved")
    void alreadyExpired() throws Exception {
        when(permissionBroker.find("perm-1")).thenReturn(Optional.empty());
        when(permissionBroker.outcomeOf("perm-1")).thenReturn(Optional.of(PermissionOutcome.EXPIRED));

        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"perm-1\",\"approved\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("expired")));
    }

    @Test
    @DisplayName("losing the race to the timer is reported as already resolved")
    void lostRace() throws Exception {
        when(permissionBroker.find("perm-1")).thenReturn(Optional.of(pending("perm-1", "P1")));
        when(permissionBroker.resolve("perm-1", true)).thenReturn(false);
        when(permissionBroker.outcomeOf("perm-1")).thenReturn(Optional.of(PermissionOutcome.EXPIRED));

        mockMvc.perform(post("/api/permissions/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionId\":\"perm-1\",\"approved\":true}"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/permissions/pending ─────────────────────────────────

    @Test
    @DisplayName("lists pending permissions, optionally per project")
    void listsPending() throws Exception {
        when(permissionBroker.list()).thenReturn(List.of(pending("a", "P1"), pending("b", "P2")));
        when(permissionBroker.list("P1")).thenReturn(List.of(pending("a", "P1")));

        mockMvc.perform(get("/api/permissions/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/permissions/pending").param("projectId", "P1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("a"))
                .andExpect(jsonPath("$[0].kind").value("Bash"));
    }
}
