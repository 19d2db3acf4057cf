package com.sopflow.compiler.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SyntaxAnalysisRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 100_000, message = "Source code cannot exceed 100,000 characters")
        String sourceCode) {
}
