package com.sopflow.compiler.augment;

import java.time.Duration;

/**
 * @param key     id of the task whose body is being restructured
 * @param text    the task body written out as DSL text
 * @param timeout time the caller waits for the answer
 */
public record AugmentationRequest(String key, String text, Duration timeout) {
}
