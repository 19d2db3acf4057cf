package com.sopflow.compiler.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CompileRequest(
    @NotBlank(message = "Source code cannot be blank")
    @Size(max = 100_000, message = "Source code cannot exceed 100,000 characters")
    String sourceCode,

    @Size(max = 255, message = "Source name cannot exceed 255 characters")
    @Pattern(regexp = "[^\\r\\n]*", message = "Source name must be a single line")
    String sourceName,

    Boolean strict
) {

    public static final String DEFAULT_SOURCE_NAME = "workflow.sop";

    public CompileRequest(String sourceCode) {
        this(sourceCode, null, null);
    }

    public String effectiveSourceName() {
        if (sourceName == null || sourceName.isBlank()) {
            return DEFAULT_SOURCE_NAME;
        }
        return sourceName.strip();
    }
}
