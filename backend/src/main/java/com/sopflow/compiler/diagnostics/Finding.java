package com.sopflow.compiler.diagnostics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        Severity severity,
        FindingCode code,
        String message,
        String taskId,
        int line
) {

    public static Finding error(FindingCode code, String message, String taskId, int line) {
        return new Finding(Severity.ERROR, code, message, taskId, line);
    }

    public static Finding warning(FindingCode code, String message, String taskId, int line) {
        return new Finding(Severity.WARNING, code, message, taskId, line);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
