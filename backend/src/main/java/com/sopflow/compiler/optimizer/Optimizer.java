package com.sopflow.compiler.optimizer;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.BodyItems;
import com.sopflow.compiler.ast.Branch;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.Jump;
import com.sopflow.compiler.ast.NextAction;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.Terminal;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.Transfer;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.exception.InternalCompilerException;
import com.sopflow.compiler.semantic.ToolDeclaration;
import com.sopflow.compiler.validation.WorkflowGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rewrites a validated workflow: dead-code elimination, constant folding, text compaction and
 * duplicate removal, in that order, repeated until a round changes nothing.
 */
public class Optimizer {

    private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

    static final int MAX_ROUNDS = 16;

    public OptimizationResult optimize(WorkflowFile file) {
        Stats stats = new Stats();
        ConditionEvaluator evaluator = new ConditionEvaluator(file.variables());

        WorkflowFile current = file;
        int rounds = 0;
        boolean converged = false;
        while (rounds < MAX_ROUNDS) {
            rounds++;
            WorkflowFile next = eliminateDeadCode(current, stats);
            next = foldConstants(next, evaluator, stats);
            next = compactText(next, stats);
            next = removeDuplicateVariables(next, stats);
            if (next.equals(current)) {
                converged = true;
                break;
            }
            current = next;
        }
        if (!converged) {
            throw new InternalCompilerException(
                    "Optimizer did not converge within " + MAX_ROUNDS + " rounds for " + file.sourceName());
        }

        List<ToolDeclaration> tools = buildCatalog(current, stats);
        OptimizationReport report = new OptimizationReport(stats.removedTasks, stats.transfersPruned,
                stats.branchesFolded, stats.conditionalsCollapsed, stats.itemsAfterTransferRemoved,
                stats.textLinesMerged, stats.duplicateVariablesRemoved, stats.duplicateToolsRemoved, rounds);

        logger.debug("Optimized {} in {} rounds: {}", file.sourceName(), rounds, report);
        return new OptimizationResult(current, tools, report);
    }

    // dead-code elimination

    private WorkflowFile eliminateDeadCode(WorkflowFile file, Stats stats) {
        if (file.entryPoint() == null || file.findTask(file.entryPoint()).isEmpty()) {
            return file;
        }
        Set<String> reachable = WorkflowGraph.of(file).reachableFrom(file.entryPoint());

        List<TaskDecl> survivors = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            if (reachable.contains(task.id())) {
                survivors.add(task);
            } else {
                stats.removedTasks.add(task.id());
            }
        }

        Set<String> targets = survivors.stream().map(TaskDecl::id).collect(Collectors.toSet());
        targets.add(Terminal.MARKER);

        List<TaskDecl> tasks = new ArrayList<>();
        for (TaskDecl task : survivors) {
            tasks.add(task.withBody(pruneTransfers(task.body(), targets, stats)));
        }
        return file.withTasks(tasks);
    }

    private List<BodyItem> pruneTransfers(List<BodyItem> body, Set<String> targets, Stats stats) {
        List<BodyItem> out = new ArrayList<>();
        for (BodyItem item : body) {
            if (item instanceof Transfer transfer && !targets.contains(transfer.target())) {
                stats.transfersPruned++;
                continue;
            }
            if (item instanceof Conditional conditional) {
                out.add(pruneConditional(conditional, targets, stats));
                continue;
            }
            out.add(item);
        }
        return out;
    }

    /**
     * A branch that only jumps to a removed task goes away as long as one condition branch stays.
     */
    private Conditional pruneConditional(Conditional conditional, Set<String> targets, Stats stats) {
        List<Branch> kept = new ArrayList<>();
        List<Branch> dead = new ArrayList<>();
        for (Branch branch : conditional.branches()) {
            if (onlyJumpsToRemoved(branch, targets)) {
                dead.add(branch);
            } else {
                kept.add(branch);
            }
        }
        boolean keepsCondition = kept.stream().anyMatch(branch -> !branch.isElse());
        List<Branch> branches = new ArrayList<>();
        for (Branch branch : conditional.branches()) {
            if (keepsCondition && dead.contains(branch)) {
                stats.transfersPruned++;
                continue;
            }
            branches.add(branch.withBody(pruneTransfers(branch.body(), targets, stats)));
        }
        return new Conditional(branches, conditional.line());
    }

    private static boolean onlyJumpsToRemoved(Branch branch, Set<String> targets) {
        return branch.body().size() == 1
                && branch.body().get(0) instanceof Transfer transfer
                && !targets.contains(transfer.target());
    }

    // constant folding

    private WorkflowFile foldConstants(WorkflowFile file, ConditionEvaluator evaluator, Stats stats) {
        List<TaskDecl> tasks = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            List<BodyItem> folded = new ArrayList<>();
            for (BodyItem item : foldBody(task.body(), evaluator, stats)) {
                folded.add(item instanceof Jump jump ? new NextAction(jump.target(), jump.line()) : item);
            }
            if (folded.isEmpty() && !task.body().isEmpty() && !task.isTerminal()) {
                // every folded path fell through
                folded.add(new NextAction(Terminal.MARKER, task.body().get(task.body().size() - 1).line()));
            }
            tasks.add(task.withBody(folded));
        }
        return file.withTasks(tasks);
    }

    /**
     * Folds the conditionals of a body and drops whatever follows its first unconditional transfer.
     */
    private List<BodyItem> foldBody(List<BodyItem> body, ConditionEvaluator evaluator, Stats stats) {
        List<BodyItem> out = new ArrayList<>();
        for (BodyItem item : body) {
            if (!out.isEmpty() && out.get(out.size() - 1) instanceof Transfer) {
                stats.itemsAfterTransferRemoved++;
                continue;
            }
            if (item instanceof Conditional conditional) {
                out.addAll(foldConditional(conditional, evaluator, stats));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    private List<BodyItem> foldConditional(Conditional conditional, ConditionEvaluator evaluator, Stats stats) {
        List<Branch> kept = new ArrayList<>();
        for (Branch branch : conditional.branches()) {
            List<BodyItem> body = foldBody(branch.body(), evaluator, stats);
            if (branch.isElse()) {
                kept.add(branch.withBody(body));
                break;
            }
            Optional<Boolean> decided = evaluator.fold(branch.condition());
            if (decided.isEmpty()) {
                kept.add(branch.withBody(body));
                continue;
            }
            stats.branchesFolded++;
            if (decided.get()) {
                if (kept.isEmpty()) {
                    stats.conditionalsCollapsed++;
                    return body;
                }
                kept.add(Branch.otherwise(body, branch.line()));
                break;
            }
        }

        if (kept.stream().noneMatch(branch -> !branch.isElse())) {
            stats.conditionalsCollapsed++;
            return kept.isEmpty() ? List.of() : kept.get(0).body();
        }
        return List.of(new Conditional(kept, conditional.line()));
    }

    // text compaction

    private WorkflowFile compactText(WorkflowFile file, Stats stats) {
        List<TaskDecl> tasks = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            tasks.add(task.withBody(compactBody(task.body(), stats)));
        }
        return file.withTasks(tasks);
    }

    private List<BodyItem> compactBody(List<BodyItem> body, Stats stats) {
        List<BodyItem> out = new ArrayList<>();
        for (BodyItem item : body) {
            if (item instanceof TextLine text && !out.isEmpty() && out.get(out.size() - 1) instanceof TextLine previous) {
                out.set(out.size() - 1, new TextLine(previous.content() + "\n" + text.content(), previous.line()));
                stats.textLinesMerged++;
            } else if (item instanceof Conditional conditional) {
                List<Branch> branches = new ArrayList<>();
                for (Branch branch : conditional.branches()) {
                    branches.add(branch.withBody(compactBody(branch.body(), stats)));
                }
                out.add(new Conditional(branches, conditional.line()));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    // duplicate removal

    private WorkflowFile removeDuplicateVariables(WorkflowFile file, Stats stats) {
        List<VariableDecl> variables = new ArrayList<>();
        for (VariableDecl variable : file.variables()) {
            boolean duplicate = variables.stream().anyMatch(kept -> kept.name().equals(variable.name())
                    && Objects.equals(kept.value(), variable.value())
                    && kept.sameDefinition(variable));
            if (duplicate) {
                stats.duplicateVariablesRemoved++;
            } else {
                variables.add(variable);
            }
        }
        return file.withVariables(variables);
    }

    private List<ToolDeclaration> buildCatalog(WorkflowFile file, Stats stats) {
        List<ToolDeclaration> catalog = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            BodyItems.forEach(task.body(), item -> {
                ToolDeclaration declaration;
                if (item instanceof ToolCall call) {
                    declaration = ToolDeclaration.of(call);
                } else if (item instanceof AgentCall call) {
                    declaration = ToolDeclaration.of(call);
                } else {
                    return;
                }
                if (catalog.stream().anyMatch(existing -> existing.sameSignature(declaration))) {
                    stats.duplicateToolsRemoved++;
                } else {
                    catalog.add(declaration);
                }
            });
        }
        return catalog;
    }

    private static final class Stats {
        private final List<String> removedTasks = new ArrayList<>();
        private int transfersPruned;
        private int branchesFolded;
        private int conditionalsCollapsed;
        private int itemsAfterTransferRemoved;
        private int textLinesMerged;
        private int duplicateVariablesRemoved;
        private int duplicateToolsRemoved;
    }
}
