package com.sopflow.compiler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sopflow.compiler.ast.ValueType;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.optimizer.OptimizationReport;
import com.sopflow.compiler.semantic.ToolDeclaration;

import java.util.List;
import java.util.Map;

/**
 * The compiled workflow handed to downstream serializers and executors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"formatVersion", "metadata", "variables", "tools", "tasks", "entryPoint",
        "compilerVersion", "sourceFiles", "findings"})
public record WorkflowDocument(
        String formatVersion,
        Metadata metadata,
        List<Variable> variables,
        List<ToolDeclaration> tools,
        List<Task> tasks,
        String entryPoint,
        String compilerVersion,
        List<String> sourceFiles,
        List<Finding> findings
) {

    public static final String FORMAT_VERSION = "1.0";

    /**
     * @param directiveCounts directives written in the source, keyed by {@code @keyword}
     * @param compiledAt      ISO-8601 instant
     * @param language        {@code @lang} tag
     * @param preamble        free text written before the first task
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            Map<String, Integer> directiveCounts,
            List<String> sourceFiles,
            String compiledAt,
            String language,
            List<String> preamble,
            int augmentedTasks,
            OptimizationReport optimization
    ) {
    }

    public record Variable(String name, Object value, ValueType type, String scope) {
    }

    /**
     * @param next         distinct successor ids, {@code END} included
     * @param dependencies ids of tasks with an edge into this one
     */
    public record Task(
            String id,
            String title,
            List<Block> body,
            List<String> next,
            List<String> dependencies,
            TaskMetadata metadata
    ) {
    }

    public record TaskMetadata(int line) {
    }

    /**
     * One body item; only the fields of its {@code type} are set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Block(
            String type,
            String content,
            String name,
            String description,
            Map<String, String> parameters,
            List<Branch> branches,
            String target,
            int line
    ) {

        public static Block text(String content, int line) {
            return new Block("text", content, null, null, null, null, null, line);
        }

        public static Block tool(String name, String description, int line) {
            return new Block("tool", null, name, description, null, null, null, line);
        }

        public static Block agent(String name, Map<String, String> parameters, int line) {
            return new Block("agent", null, name, null, parameters, null, null, line);
        }

        public static Block conditional(List<Branch> branches, int line) {
            return new Block("conditional", null, null, null, null, branches, null, line);
        }

        public static Block jump(String target, int line) {
            return new Block("jump", null, null, null, null, null, target, line);
        }

        public static Block next(String target, int line) {
            return new Block("next", null, null, null, null, null, target, line);
        }
    }

    /**
     * @param condition condition text, {@code null} for the else-branch
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Branch(String condition, boolean otherwise, List<Block> body) {
    }
}
