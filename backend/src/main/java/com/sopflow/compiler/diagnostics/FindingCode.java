package com.sopflow.compiler.diagnostics;

public enum FindingCode {
    EMPTY_TASK_BODY,
    CONFLICTING_TOOL_DECLARATION,
    AUGMENTATION_DEGRADED,
    MISSING_ENTRY_POINT,
    UNKNOWN_JUMP_TARGET,
    TERMINAL_HAS_OUTGOING_EDGE,
    UNREACHABLE_TASK,
    INCOMPLETE_FLOW,
    MALFORMED_CONDITIONAL
}
