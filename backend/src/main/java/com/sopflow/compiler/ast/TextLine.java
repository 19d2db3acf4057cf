package com.sopflow.compiler.ast;

public record TextLine(String content, int line) implements BodyItem {

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.TEXT;
    }
}
