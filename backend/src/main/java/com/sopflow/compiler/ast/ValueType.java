package com.sopflow.compiler.ast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValueType {
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    STRING("string");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
