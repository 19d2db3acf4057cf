package com.sopflow.compiler.semantic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.ToolCall;

import java.util.List;
import java.util.Objects;

/**
 * First-seen declaration of a tool or agent.
 *
 * @param kind          tool or agent
 * @param name          invoked name
 * @param description   tool description, {@code null} for agents and bare tools
 * @param parameterKeys agent parameter keys in call order, empty for tools
 * @param line          line of the first use
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDeclaration(ToolKind kind, String name, String description, List<String> parameterKeys,
                              @JsonIgnore int line) {

    public ToolDeclaration {
        parameterKeys = List.copyOf(parameterKeys);
    }

    public static ToolDeclaration of(ToolCall call) {
        return new ToolDeclaration(ToolKind.TOOL, call.name(), call.description(), List.of(), call.line());
    }

    public static ToolDeclaration of(AgentCall call) {
        return new ToolDeclaration(ToolKind.AGENT, call.name(), null, call.parameterKeys(), call.line());
    }

    /**
     * Same kind, name, description and parameter keys; the line is ignored.
     */
    public boolean sameSignature(ToolDeclaration other) {
        return kind == other.kind
                && name.equals(other.name)
                && Objects.equals(description, other.description)
                && parameterKeys.equals(other.parameterKeys);
    }
}
