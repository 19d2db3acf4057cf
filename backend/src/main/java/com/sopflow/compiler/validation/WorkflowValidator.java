package com.sopflow.compiler.validation;

import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.BodyItems;
import com.sopflow.compiler.ast.Branch;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.Terminal;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.ValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Control-flow checks over the {@link WorkflowGraph}. All checks run and every finding is
 * collected; any error aborts with a {@link ValidationException}.
 */
public class WorkflowValidator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowValidator.class);

    private final boolean strictMode;

    public WorkflowValidator(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public ValidationResult validate(WorkflowFile file) throws ValidationException {
        WorkflowGraph graph = WorkflowGraph.of(file);
        List<Finding> findings = new ArrayList<>();

        String entry = file.entryPoint();
        boolean entryExists = entry != null && file.findTask(entry).isPresent();
        if (!entryExists) {
            findings.add(Finding.error(FindingCode.MISSING_ENTRY_POINT,
                    entry == null ? "Workflow declares no tasks" : "Entry point '" + entry + "' is not a declared task",
                    null, file.entryLine()));
        }

        checkTargets(file, graph, findings);

        Set<String> reachable = entryExists ? graph.reachableFrom(entry) : graph.nodes();
        if (entryExists) {
            for (TaskDecl task : file.tasks()) {
                if (!reachable.contains(task.id()) && !task.isTerminal()) {
                    String message = "Task '" + task.id() + "' is unreachable from entry point '" + entry + "'";
                    findings.add(strictMode
                            ? Finding.error(FindingCode.UNREACHABLE_TASK, message, task.id(), task.line())
                            : Finding.warning(FindingCode.UNREACHABLE_TASK, message, task.id(), task.line()));
                }
            }
        }

        Set<String> finishing = graph.reaching(Terminal.MARKER);
        for (TaskDecl task : file.tasks()) {
            if (reachable.contains(task.id()) && !finishing.contains(task.id())) {
                findings.add(Finding.error(FindingCode.INCOMPLETE_FLOW,
                        "No path from task '" + task.id() + "' reaches " + Terminal.MARKER,
                        task.id(), task.line()));
            }
        }

        for (TaskDecl task : file.tasks()) {
            checkConditionals(task, task.body(), findings);
        }

        long errors = findings.stream().filter(Finding::isError).count();
        logger.debug("Validated {}: {} edges, {} errors, {} warnings",
                file.sourceName(), graph.edges().size(), errors, findings.size() - errors);

        if (errors > 0) {
            throw new ValidationException(findings);
        }
        return new ValidationResult(graph, findings);
    }

    private void checkTargets(WorkflowFile file, WorkflowGraph graph, List<Finding> findings) {
        for (TaskDecl task : file.tasks()) {
            for (Edge edge : graph.outgoing(task.id())) {
                if (edge.implicit()) {
                    continue;
                }
                if (task.isTerminal()) {
                    findings.add(Finding.error(FindingCode.TERMINAL_HAS_OUTGOING_EDGE,
                            "Terminal task " + Terminal.MARKER + " cannot jump to '" + edge.to() + "'",
                            task.id(), edge.line()));
                } else if (!graph.contains(edge.to())) {
                    findings.add(Finding.error(FindingCode.UNKNOWN_JUMP_TARGET,
                            "Task '" + task.id() + "' jumps to unknown task '" + edge.to() + "'",
                            task.id(), edge.line()));
                }
            }
        }
    }

    private void checkConditionals(TaskDecl task, List<BodyItem> body, List<Finding> findings) {
        BodyItems.forEach(body, item -> {
            if (item instanceof Conditional conditional) {
                String problem = conditionalProblem(conditional);
                if (problem != null) {
                    findings.add(Finding.error(FindingCode.MALFORMED_CONDITIONAL,
                            problem, task.id(), conditional.line()));
                }
            }
        });
    }

    private static String conditionalProblem(Conditional conditional) {
        if (conditional.conditionBranchCount() == 0) {
            return "Conditional has no condition branch";
        }
        if (conditional.elseBranchCount() > 1) {
            return "Conditional has more than one else-branch";
        }
        List<Branch> branches = conditional.branches();
        for (int i = 0; i < branches.size() - 1; i++) {
            if (branches.get(i).isElse()) {
                return "Else-branch must be the last branch of a conditional";
            }
        }
        return null;
    }
}
