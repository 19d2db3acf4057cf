package com.sopflow.compiler.exception;

public class StructuralException extends CompilationException {

    public StructuralException(String message, int line) {
        super(CompilationStage.STRUCTURAL, message, line);
    }
}
