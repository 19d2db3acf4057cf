package com.sopflow.compiler.semantic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolKind {
    TOOL("tool"),
    AGENT("agent");

    private final String label;

    ToolKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
