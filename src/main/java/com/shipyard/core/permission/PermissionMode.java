package com.shipyard.core.permission;

import java.util.Set;

/**
 * Per-project policy deciding which tools run without asking a human.
 */
public enum PermissionMode {
    /** Read-only tools run; everything else asks. */
    DEFAULT,
    /** Read-only and file-editing tools run; everything else asks. */
    ACCEPT_EDITS,
    /** Everything runs. */
    BYPASS_PERMISSIONS;

    static final Set<String> READ_ONLY_TOOLS = Set.of(
            "Read", "Glob", "Grep", "LS", "ListDirectory", "Task",
            "TodoRead", "TodoWrite", "WebFetch", "WebSearch");

    static final Set<String> EDIT_TOOLS = Set.of("Write", "Edit", "NotebookEdit");

    public boolean autoApproves(String toolName) {
        return switch (this) {
            case BYPASS_PERMISSIONS -> true;
            case ACCEPT_EDITS -> READ_ONLY_TOOLS.contains(toolName) || EDIT_TOOLS.contains(toolName);
            case DEFAULT -> READ_ONLY_TOOLS.contains(toolName);
        };
    }
}
