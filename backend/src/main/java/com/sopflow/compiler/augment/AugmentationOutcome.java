package com.sopflow.compiler.augment;

import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.Finding;

import java.util.List;

/**
 * @param workflow       augmented workflow, or the input unchanged after a fallback
 * @param warnings       degradation warnings
 * @param tasksAugmented number of task bodies replaced
 */
public record AugmentationOutcome(WorkflowFile workflow, List<Finding> warnings, int tasksAugmented) {

    public AugmentationOutcome {
        warnings = List.copyOf(warnings);
    }

    public boolean degraded() {
        return !warnings.isEmpty();
    }
}
