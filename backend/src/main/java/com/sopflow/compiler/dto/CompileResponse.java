package com.sopflow.compiler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.ValidationException;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        WorkflowDocument document,
        List<Finding> findings,
        String error,
        Integer errorLine,
        Long executionTimeMs,
        String resultType
) {

    public static CompileResponse success(WorkflowDocument document, long executionTimeMs) {
        return new CompileResponse(
                true,
                document,
                document.findings(),
                null,
                null,
                executionTimeMs,
                "success");
    }

    public static CompileResponse failure(CompilationException e, long executionTimeMs) {
        List<Finding> findings = e instanceof ValidationException validation ? validation.getFindings() : List.of();
        return new CompileResponse(
                false,
                null,
                findings,
                e.getMessage(),
                e.getLine() > 0 ? e.getLine() : null,
                executionTimeMs,
                e.getStage().resultType());
    }

    public static CompileResponse internalError(String error, long executionTimeMs) {
        return new CompileResponse(
                false,
                null,
                List.of(),
                error,
                null,
                executionTimeMs,
                "internal_error");
    }

    public static CompileResponse invalidRequest(String error) {
        return new CompileResponse(
                false,
                null,
                List.of(),
                error,
                null,
                null,
                "invalid_request");
    }
}
