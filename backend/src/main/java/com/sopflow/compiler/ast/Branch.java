package com.sopflow.compiler.ast;

import java.util.List;

/**
 * One arm of a {@link Conditional}. A {@code null} condition marks the else-branch.
 */
public record Branch(String condition, List<BodyItem> body, int line) {

    public Branch {
        body = List.copyOf(body);
    }

    public static Branch otherwise(List<BodyItem> body, int line) {
        return new Branch(null, body, line);
    }

    public boolean isElse() {
        return condition == null;
    }

    public Branch withBody(List<BodyItem> newBody) {
        return new Branch(condition, newBody, line);
    }

    public Branch asElse() {
        return new Branch(null, body, line);
    }
}
