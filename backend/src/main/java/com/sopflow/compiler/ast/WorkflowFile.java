package com.sopflow.compiler.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of the AST for one compilation unit.
 *
 * @param sourceName    name the source was compiled under
 * @param language      {@code @lang} tag, {@code null} when absent
 * @param entryPoint    explicit entry override, else the first task id; {@code null} without tasks
 * @param entryDeclared whether the entry point came from a top-level {@code @next}
 * @param entryLine     line of the override, or of the first task
 * @param variables     global variables in declaration order
 * @param tasks         tasks in declaration order
 * @param preamble      free text written before the first task
 */
public record WorkflowFile(
        String sourceName,
        String language,
        String entryPoint,
        boolean entryDeclared,
        int entryLine,
        List<VariableDecl> variables,
        List<TaskDecl> tasks,
        List<TextLine> preamble
) {

    public WorkflowFile {
        variables = List.copyOf(variables);
        tasks = List.copyOf(tasks);
        preamble = List.copyOf(preamble);
    }

    public Optional<TaskDecl> findTask(String id) {
        return tasks.stream().filter(task -> task.id().equals(id)).findFirst();
    }

    public WorkflowFile withTasks(List<TaskDecl> newTasks) {
        return new WorkflowFile(sourceName, language, entryPoint, entryDeclared, entryLine,
                variables, newTasks, preamble);
    }

    public WorkflowFile withVariables(List<VariableDecl> newVariables) {
        return new WorkflowFile(sourceName, language, entryPoint, entryDeclared, entryLine,
                newVariables, tasks, preamble);
    }
}
