package com.shipyard.core.permission;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolApprovalGateTest {

    private PermissionBroker broker;
    private ToolApprovalGate gate;

    @BeforeEach
    void setUp() {
        broker = mock(PermissionBroker.class);
        gate = new ToolApprovalGate(broker, PermissionMode.DEFAULT, null);
    }

    @Nested
    @DisplayName("PermissionMode")
    class ModeTests {

        @Test
        @DisplayName("DEFAULT only approves read-only tools")
        void defaultMode() {
            assertTrue(PermissionMode.DEFAULT.autoApproves("Read"));
            assertFalse(PermissionMode.DEFAULT.autoApproves("Write"));
            assertFalse(PermissionMode.DEFAULT.autoApproves("Bash"));
        }

        @Test
        @DisplayName("ACCEPT_EDITS also approves editing tools")
        void acceptEdits() {
            assertTrue(PermissionMode.ACCEPT_EDITS.autoApproves("Edit"));
            assertTrue(PermissionMode.ACCEPT_EDITS.autoApproves("Grep"));
            assertFalse(PermissionMode.ACCEPT_EDITS.autoApproves("Bash"));
        }

        @Test
        @DisplayName("BYPASS_PERMISSIONS approves everything")
        void bypass() {
            assertTrue(PermissionMode.BYPASS_PERMISSIONS.autoApproves("Bash"));
        }
    }

    @Test
    @DisplayName("auto-approved tools never reach the broker")
    void autoApproved() throws Exception {
        var decision = gate.requestApproval("P1", "r1", "tool-1", "Read", Map.of("path", "a.txt"), null);

        assertTrue(decision.get());
        verifyNoInteractions(broker);
    }

    @Test
    @DisplayName("gated tools become pending permissions keyed by tool-use id")
    void gatedTool() {
        var pending = new CompletableFuture<Boolean>();
        when(broker.create(any(PermissionRequest.class))).thenReturn(pending);

        var decision = gate.requestApproval("P1", "r1", "tool-2", "Bash", Map.of("command", "ls"),
                PermissionMode.ACCEPT_EDITS);

        assertSame(pending, decision);
        verify(broker).create(new PermissionRequest("tool-2", "Bash", Map.of("command", "ls"), "P1", "r1"));
    }
}
