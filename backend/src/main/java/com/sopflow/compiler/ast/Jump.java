package com.sopflow.compiler.ast;

/**
 * {@code @next} written inside a branch.
 */
public record Jump(String target, int line) implements Transfer {

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.JUMP;
    }

    @Override
    public Transfer retarget(String newTarget) {
        return new Jump(newTarget, line);
    }
}
