package com.sopflow.compiler.optimizer;

import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.semantic.ToolDeclaration;

import java.util.List;

public record OptimizationResult(WorkflowFile workflow, List<ToolDeclaration> tools, OptimizationReport report) {

    public OptimizationResult {
        tools = List.copyOf(tools);
    }
}
