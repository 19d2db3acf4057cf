package com.sopflow.compiler.augment;

import java.io.IOException;

/**
 * Remote text-structuring service that turns free-form task text into DSL body items.
 */
public interface AugmentationClient {

    AugmentationResponse augment(AugmentationRequest request) throws IOException, InterruptedException;
}
