package com.sopflow.compiler.ast;

public record ToolCall(String name, String description, int line) implements BodyItem {

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.TOOL_CALL;
    }
}
