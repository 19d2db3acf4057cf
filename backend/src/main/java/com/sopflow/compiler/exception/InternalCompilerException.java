package com.sopflow.compiler.exception;

/**
 * A broken compiler invariant. Never caused by user input; reported apart from
 * {@link CompilationException}.
 */
public class InternalCompilerException extends RuntimeException {

    public InternalCompilerException(String message) {
        super(message);
    }

    public InternalCompilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
