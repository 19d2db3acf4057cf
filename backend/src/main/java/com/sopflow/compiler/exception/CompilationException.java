package com.sopflow.compiler.exception;

public class CompilationException extends Exception {

    private final CompilationStage stage;
    private final int line;

    public CompilationException(CompilationStage stage, String message, int line) {
        super(message);
        this.stage = stage;
        this.line = line;
    }

    public CompilationException(CompilationStage stage, String message, int line, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.line = line;
    }

    public CompilationStage getStage() {
        return stage;
    }

    /**
     * Source line of the offending construct, or 0 when the error is not tied to a line.
     */
    public int getLine() {
        return line;
    }

    @Override
    public String getMessage() {
        if (line > 0) {
            return super.getMessage() + " (line " + line + ")";
        }
        return super.getMessage();
    }
}
