package com.sopflow.compiler.exception;

public class SemanticException extends CompilationException {

    public enum Code {
        DUPLICATE_VARIABLE,
        DUPLICATE_TASK,
        UNDECLARED_VARIABLE_REFERENCE,
        INVALID_LITERAL
    }

    private final Code code;

    public SemanticException(Code code, String message, int line) {
        super(CompilationStage.SEMANTIC, message, line);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }
}
