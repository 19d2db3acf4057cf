package com.sopflow.compiler.semantic;

import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.VariableDecl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variables, tasks and tools of one compilation unit, in declaration order. Built once by
 * {@link SemanticAnalyzer} and read-only afterwards.
 */
public final class SymbolTable {

    private final Map<String, VariableDecl> variables;
    private final Map<String, TaskDecl> tasks;
    private final Map<String, ToolDeclaration> tools;

    private SymbolTable(Builder builder) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tasks));
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<VariableDecl> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Optional<TaskDecl> task(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public boolean hasTask(String id) {
        return tasks.containsKey(id);
    }

    public Optional<ToolDeclaration> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<VariableDecl> variables() {
        return List.copyOf(variables.values());
    }

    public List<TaskDecl> tasks() {
        return List.copyOf(tasks.values());
    }

    public List<ToolDeclaration> tools() {
        return List.copyOf(tools.values());
    }

    public static final class Builder {

        private final Map<String, VariableDecl> variables = new LinkedHashMap<>();
        private final Map<String, TaskDecl> tasks = new LinkedHashMap<>();
        private final Map<String, ToolDeclaration> tools = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @return {@code false} when a variable of that name is already registered
         */
        public boolean addVariable(VariableDecl variable) {
            return variables.putIfAbsent(variable.name(), variable) == null;
        }

        public boolean addTask(TaskDecl task) {
            return tasks.putIfAbsent(task.id(), task) == null;
        }

        /**
         * Registers the declaration on first use and returns the registered one.
         */
        public ToolDeclaration addTool(ToolDeclaration tool) {
            ToolDeclaration existing = tools.putIfAbsent(tool.name(), tool);
            return existing != null ? existing : tool;
        }

        public boolean hasVariable(String name) {
            return variables.containsKey(name);
        }

        public SymbolTable build() {
            return new SymbolTable(this);
        }
    }
}
