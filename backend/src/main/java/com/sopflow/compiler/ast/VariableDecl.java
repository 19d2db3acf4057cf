package com.sopflow.compiler.ast;

import java.util.Objects;

/**
 * A global {@code @var}. {@code type} and {@code value} are {@code null} until semantic
 * analysis has inferred them from {@code rawValue}.
 *
 * @param name     variable name
 * @param rawValue literal text after {@code =}, {@code null} when absent
 * @param value    typed literal: Long, Double, Boolean or String
 * @param type     inferred type
 * @param scope    always {@link Scope#GLOBAL}
 * @param line     source line
 */
public record VariableDecl(String name, String rawValue, Object value, ValueType type, Scope scope, int line) {

    public static VariableDecl declared(String name, String rawValue, int line) {
        return new VariableDecl(name, rawValue, null, null, null, line);
    }

    public VariableDecl annotate(Object typedValue, ValueType inferredType) {
        return new VariableDecl(name, rawValue, typedValue, inferredType, Scope.GLOBAL, line);
    }

    public boolean isAnnotated() {
        return type != null;
    }

    public boolean sameDefinition(VariableDecl other) {
        return name.equals(other.name) && Objects.equals(rawValue, other.rawValue);
    }
}
