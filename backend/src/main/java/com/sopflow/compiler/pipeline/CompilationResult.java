package com.sopflow.compiler.pipeline;

import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.optimizer.OptimizationResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A successfully compiled unit.
 *
 * @param sourceName      name the unit was compiled under
 * @param directiveCounts directives written in the source, by kind
 * @param optimization    optimized workflow, tool catalog and optimization report
 * @param findings        warnings from every stage, in stage order
 * @param augmentedTasks  number of task bodies replaced by augmentation
 */
public record CompilationResult(
        String sourceName,
        Map<DirectiveKind, Integer> directiveCounts,
        OptimizationResult optimization,
        List<Finding> findings,
        int augmentedTasks
) {

    public CompilationResult {
        directiveCounts = Collections.unmodifiableMap(new EnumMap<>(directiveCounts));
        findings = List.copyOf(findings);
    }
}
