package com.sopflow.compiler.pipeline;

import java.time.Duration;

/**
 * Per-unit compiler switches.
 *
 * @param strictMode            report unreachable tasks as errors instead of warnings
 * @param tabWidth              columns a tab expands to before lexing
 * @param augment               run the augmentation stage
 * @param augmentationMandatory fail the unit instead of degrading when augmentation fails
 * @param augmentationTimeout   wait for one augmentation call
 */
public record CompilerOptions(
        boolean strictMode,
        int tabWidth,
        boolean augment,
        boolean augmentationMandatory,
        Duration augmentationTimeout
) {

    public static CompilerOptions defaults() {
        return new CompilerOptions(false, 4, false, false, Duration.ofSeconds(30));
    }

    public CompilerOptions withStrictMode(boolean strict) {
        return new CompilerOptions(strict, tabWidth, augment, augmentationMandatory, augmentationTimeout);
    }

    public CompilerOptions withAugmentation(boolean enabled, boolean mandatory, Duration timeout) {
        return new CompilerOptions(strictMode, tabWidth, enabled, mandatory, timeout);
    }
}
