package com.sopflow.compiler.exception;

public class AugmentationException extends CompilationException {

    public AugmentationException(String message) {
        super(CompilationStage.AUGMENTATION, message, 0);
    }

    public AugmentationException(String message, Throwable cause) {
        super(CompilationStage.AUGMENTATION, message, 0, cause);
    }
}
