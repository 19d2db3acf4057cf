package com.sopflow.compiler.optimizer;

import java.util.List;

/**
 * Totals over all optimizer rounds.
 *
 * @param removedTasks              ids of tasks dropped as unreachable, in declaration order
 * @param transfersPruned           transfers to tasks that no longer exist
 * @param branchesFolded            branches whose condition was decided at compile time
 * @param conditionalsCollapsed     conditionals replaced by a body or removed
 * @param itemsAfterTransferRemoved body items dropped because an earlier transfer always leaves
 * @param textLinesMerged           text lines merged into the preceding one
 * @param duplicateVariablesRemoved identical variable declarations collapsed
 * @param duplicateToolsRemoved     identical tool or agent declarations left out of the catalog
 * @param rounds                    rounds run, the final unchanged round included
 */
public record OptimizationReport(
        List<String> removedTasks,
        int transfersPruned,
        int branchesFolded,
        int conditionalsCollapsed,
        int itemsAfterTransferRemoved,
        int textLinesMerged,
        int duplicateVariablesRemoved,
        int duplicateToolsRemoved,
        int rounds
) {

    public OptimizationReport {
        removedTasks = List.copyOf(removedTasks);
    }

    public int tasksRemoved() {
        return removedTasks.size();
    }
}
