package com.sopflow.compiler.ast;

public enum BodyItemKind {
    TEXT,
    TOOL_CALL,
    AGENT_CALL,
    CONDITIONAL,
    JUMP,
    NEXT_ACTION
}
