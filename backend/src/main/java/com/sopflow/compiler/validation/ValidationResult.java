package com.sopflow.compiler.validation;

import com.sopflow.compiler.diagnostics.Finding;

import java.util.List;

/**
 * A passed validation: the graph it was checked on and the remaining warnings.
 */
public record ValidationResult(WorkflowGraph graph, List<Finding> warnings) {

    public ValidationResult {
        warnings = List.copyOf(warnings);
    }
}
