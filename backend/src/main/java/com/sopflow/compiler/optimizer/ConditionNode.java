package com.sopflow.compiler.optimizer;

/**
 * Parsed form of a foldable {@code @if} condition.
 */
public interface ConditionNode {

    record Binary(String operator, ConditionNode left, ConditionNode right) implements ConditionNode {
    }

    record Not(ConditionNode operand) implements ConditionNode {
    }

    /**
     * Number (Long or Double), string or boolean literal.
     */
    record Constant(Object value) implements ConditionNode {
    }

    /**
     * Bare identifier, possibly dotted. Only a declared variable name makes it foldable.
     */
    record Identifier(String name) implements ConditionNode {
    }

    /**
     * {@code {{name}}} inside a condition.
     */
    record Placeholder(String name) implements ConditionNode {
    }
}
