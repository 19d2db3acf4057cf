package com.sopflow.compiler.augment;

/**
 * @param changed  whether the service rewrote the body
 * @param fragment replacement body as DSL text, unindented; ignored unless {@code changed}
 */
public record AugmentationResponse(boolean changed, String fragment) {

    public static AugmentationResponse unchanged() {
        return new AugmentationResponse(false, null);
    }

    public static AugmentationResponse rewritten(String fragment) {
        return new AugmentationResponse(true, fragment);
    }
}
