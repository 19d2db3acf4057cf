package com.sopflow.compiler.ast;

/**
 * {@code @next} written directly in a task body.
 */
public record NextAction(String target, int line) implements Transfer {

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.NEXT_ACTION;
    }

    @Override
    public Transfer retarget(String newTarget) {
        return new NextAction(newTarget, line);
    }
}
