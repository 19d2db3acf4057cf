package com.sopflow.compiler.semantic;

import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.Finding;

import java.util.List;

/**
 * Output of semantic analysis: the annotated AST, its symbols and the warnings raised.
 */
public record AnalyzedWorkflow(WorkflowFile workflow, SymbolTable symbols, List<Finding> warnings) {

    public AnalyzedWorkflow {
        warnings = List.copyOf(warnings);
    }
}
