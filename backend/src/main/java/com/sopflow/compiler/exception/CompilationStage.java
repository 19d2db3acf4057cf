package com.sopflow.compiler.exception;

public enum CompilationStage {
    LEXICAL("lexical_error"),
    STRUCTURAL("structural_error"),
    SEMANTIC("semantic_error"),
    AUGMENTATION("augmentation_error"),
    VALIDATION("validation_error");

    private final String resultType;

    CompilationStage(String resultType) {
        this.resultType = resultType;
    }

    public String resultType() {
        return resultType;
    }
}
