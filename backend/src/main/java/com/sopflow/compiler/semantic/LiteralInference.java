package com.sopflow.compiler.semantic;

import com.sopflow.compiler.ast.ValueType;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.exception.SemanticException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Infers the type of a {@code @var} literal from its shape.
 */
public final class LiteralInference {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(?=[eE]))([eE][+-]?\\d+)?");

    private LiteralInference() {
    }

    public static VariableDecl annotate(VariableDecl variable) throws SemanticException {
        String raw = variable.rawValue();
        if (raw == null || raw.isBlank()) {
            throw invalid(variable, "has no value");
        }
        raw = raw.strip();

        if (INTEGER.matcher(raw).matches()) {
            try {
                return variable.annotate(Long.parseLong(raw), ValueType.INTEGER);
            } catch (NumberFormatException e) {
                throw invalid(variable, "is out of the integer range");
            }
        }
        if (FLOAT.matcher(raw).matches()) {
            double value = Double.parseDouble(raw);
            if (Double.isInfinite(value)) {
                throw invalid(variable, "is out of the float range");
            }
            return variable.annotate(value, ValueType.FLOAT);
        }

        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return variable.annotate(Boolean.parseBoolean(lower), ValueType.BOOLEAN);
        }
        if (lower.equals("null") || lower.equals("none")) {
            throw invalid(variable, "has no value ('" + raw + "' is not a literal)");
        }

        char first = raw.charAt(0);
        char last = raw.charAt(raw.length() - 1);
        boolean opens = first == '"' || first == '\'';
        boolean closes = last == '"' || last == '\'';
        if (opens || closes) {
            if (raw.length() < 2 || first != last) {
                throw invalid(variable, "has unbalanced quotes");
            }
            String inner = raw.substring(1, raw.length() - 1);
            if (inner.indexOf(first) >= 0) {
                throw invalid(variable, "has unbalanced quotes");
            }
            return variable.annotate(inner, ValueType.STRING);
        }
        return variable.annotate(raw, ValueType.STRING);
    }

    private static SemanticException invalid(VariableDecl variable, String reason) {
        return new SemanticException(SemanticException.Code.INVALID_LITERAL,
                "Variable '" + variable.name() + "' " + reason, variable.line());
    }
}
