package com.sopflow.compiler.semantic;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.AgentParameter;
import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.Branch;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.SemanticException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Symbol collection, literal typing, {@code {{name}}} resolution and default completion.
 * Fails fast on the first error; warnings are returned with the result.
 */
public class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    public AnalyzedWorkflow analyze(WorkflowFile file) throws SemanticException {
        SymbolTable.Builder symbols = SymbolTable.builder();
        List<Finding> warnings = new ArrayList<>();

        List<VariableDecl> variables = new ArrayList<>();
        for (VariableDecl variable : file.variables()) {
            VariableDecl typed = variable.isAnnotated() ? variable : LiteralInference.annotate(variable);
            if (!symbols.addVariable(typed)) {
                throw new SemanticException(SemanticException.Code.DUPLICATE_VARIABLE,
                        "Variable '" + variable.name() + "' is already declared", variable.line());
            }
            variables.add(typed);
        }

        List<TaskDecl> tasks = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            TaskDecl completed = task.title() == null || task.title().isBlank()
                    ? task.withTitle(defaultTitle(task.id()))
                    : task;
            if (!symbols.addTask(completed)) {
                throw new SemanticException(SemanticException.Code.DUPLICATE_TASK,
                        "Task '" + task.id() + "' is already declared", task.line());
            }
            tasks.add(completed);
        }

        for (TextLine text : file.preamble()) {
            checkReferences(text.content(), text.line(), symbols);
        }

        for (TaskDecl task : tasks) {
            checkBody(task, task.body(), symbols, warnings);
            if (task.body().isEmpty()) {
                warnings.add(Finding.warning(FindingCode.EMPTY_TASK_BODY,
                        "Task '" + task.id() + "' has an empty body", task.id(), task.line()));
            }
        }

        logger.debug("Semantic analysis of {}: {} variables, {} tasks, {} warnings",
                file.sourceName(), variables.size(), tasks.size(), warnings.size());

        WorkflowFile annotated = file.withVariables(variables).withTasks(tasks);
        return new AnalyzedWorkflow(annotated, symbols.build(), warnings);
    }

    private void checkBody(TaskDecl task, List<BodyItem> body, SymbolTable.Builder symbols,
                           List<Finding> warnings) throws SemanticException {
        for (BodyItem item : body) {
            switch (item.kind()) {
                case TEXT -> checkReferences(((TextLine) item).content(), item.line(), symbols);
                case TOOL_CALL -> {
                    ToolCall call = (ToolCall) item;
                    checkReferences(call.description(), call.line(), symbols);
                    register(task, ToolDeclaration.of(call), symbols, warnings);
                }
                case AGENT_CALL -> {
                    AgentCall call = (AgentCall) item;
                    for (AgentParameter parameter : call.parameters()) {
                        checkReferences(parameter.value(), call.line(), symbols);
                    }
                    register(task, ToolDeclaration.of(call), symbols, warnings);
                }
                case CONDITIONAL -> {
                    for (Branch branch : ((Conditional) item).branches()) {
                        checkReferences(branch.condition(), branch.line(), symbols);
                        checkBody(task, branch.body(), symbols, warnings);
                    }
                }
                case JUMP, NEXT_ACTION -> {
                    // targets are resolved by the validator
                }
            }
        }
    }

    private void register(TaskDecl task, ToolDeclaration declaration, SymbolTable.Builder symbols,
                          List<Finding> warnings) {
        ToolDeclaration registered = symbols.addTool(declaration);
        if (registered != declaration && !registered.sameSignature(declaration)) {
            warnings.add(Finding.warning(FindingCode.CONFLICTING_TOOL_DECLARATION,
                    "'" + declaration.name() + "' was first declared at line " + registered.line()
                            + " with a different " + (declaration.kind() == ToolKind.AGENT
                            ? "parameter key set" : "description"),
                    task.id(), declaration.line()));
        }
    }

    private void checkReferences(String text, int line, SymbolTable.Builder symbols) throws SemanticException {
        for (String name : Placeholders.names(text)) {
            if (!symbols.hasVariable(name)) {
                throw new SemanticException(SemanticException.Code.UNDECLARED_VARIABLE_REFERENCE,
                        "Reference to undeclared variable '{{" + name + "}}'", line);
            }
        }
    }

    static String defaultTitle(String id) {
        StringBuilder title = new StringBuilder();
        for (String word : id.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.length() > 0 ? title.toString() : id;
    }
}
