package com.sopflow.compiler.optimizer;

import com.sopflow.compiler.ast.VariableDecl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides conditions whose every identifier is a compile-time variable. Anything else is a
 * runtime predicate and stays undecided.
 */
public class ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final Map<String, Object> values = new HashMap<>();

    public ConditionEvaluator(List<VariableDecl> variables) {
        for (VariableDecl variable : variables) {
            if (variable.isAnnotated()) {
                values.put(variable.name(), variable.value());
            }
        }
    }

    /**
     * @return the constant truth value, or empty when the condition cannot be decided at compile time
     */
    public Optional<Boolean> fold(String condition) {
        Optional<Boolean> result = ConditionParser.parse(condition)
                .flatMap(this::evaluate)
                .filter(Boolean.class::isInstance)
                .map(Boolean.class::cast);
        logger.trace("Condition '{}' folds to {}", condition, result.map(String::valueOf).orElse("<runtime>"));
        return result;
    }

    private Optional<Object> evaluate(ConditionNode node) {
        if (node instanceof ConditionNode.Constant constant) {
            return Optional.of(constant.value());
        }
        if (node instanceof ConditionNode.Identifier identifier) {
            return Optional.ofNullable(values.get(identifier.name()));
        }
        if (node instanceof ConditionNode.Placeholder placeholder) {
            return Optional.ofNullable(values.get(placeholder.name()));
        }
        if (node instanceof ConditionNode.Not not) {
            return evaluate(not.operand())
                    .filter(Boolean.class::isInstance)
                    .map(value -> !(Boolean) value);
        }
        if (node instanceof ConditionNode.Binary binary) {
            Optional<Object> left = evaluate(binary.left());
            Optional<Object> right = evaluate(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return apply(binary.operator(), left.get(), right.get());
        }
        return Optional.empty();
    }

    private static Optional<Object> apply(String operator, Object left, Object right) {
        switch (operator) {
            case "&&", "||" -> {
                if (!(left instanceof Boolean l) || !(right instanceof Boolean r)) {
                    return Optional.empty();
                }
                return Optional.of(operator.equals("&&") ? l && r : l || r);
            }
            case "==", "!=" -> {
                Optional<Boolean> equal = equal(left, right);
                return operator.equals("==") ? equal.map(Object.class::cast) : equal.map(value -> (Object) !value);
            }
            case "<", "<=", ">", ">=" -> {
                if (!(left instanceof Number l) || !(right instanceof Number r)) {
                    return Optional.empty();
                }
                int cmp = compare(l, r);
                return Optional.of(switch (operator) {
                    case "<" -> cmp < 0;
                    case "<=" -> cmp <= 0;
                    case ">" -> cmp > 0;
                    default -> cmp >= 0;
                });
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private static Optional<Boolean> equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Optional.of(compare(l, r) == 0);
        }
        if (left.getClass() != right.getClass()) {
            return Optional.empty();
        }
        return Optional.of(left.equals(right));
    }

    private static int compare(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            return Long.compare(l, r);
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }
}
