package com.sopflow.compiler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A highlighted range. Lines and columns are 0-based; the end column is exclusive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {
    public enum TokenType {
        DIRECTIVE,
        TASK_ID,
        TASK_TITLE,
        VARIABLE,
        PLACEHOLDER,
        TOOL_NAME,
        AGENT_NAME,
        PARAMETER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        BOOLEAN_LITERAL,
        COMMENT,
        OPERATOR,
        TEXT,
        PREDICATE,
        ERROR
    }

    public SyntaxToken withSemanticInfo(String info) {
        return new SyntaxToken(startLine, startColumn, endLine, endColumn, tokenType, value, info);
    }
}
