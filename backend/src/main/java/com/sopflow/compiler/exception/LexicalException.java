package com.sopflow.compiler.exception;

public class LexicalException extends CompilationException {

    public LexicalException(String message, int line) {
        super(CompilationStage.LEXICAL, message, line);
    }
}
