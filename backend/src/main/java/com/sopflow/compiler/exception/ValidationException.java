package com.sopflow.compiler.exception;

import com.sopflow.compiler.diagnostics.Finding;

import java.util.List;

public class ValidationException extends CompilationException {

    private final List<Finding> findings;

    public ValidationException(List<Finding> findings) {
        super(CompilationStage.VALIDATION, summarize(findings), firstErrorLine(findings));
        this.findings = List.copyOf(findings);
    }

    /**
     * Every finding of the failed validation run, warnings included.
     */
    public List<Finding> getFindings() {
        return findings;
    }

    public List<Finding> getErrors() {
        return findings.stream().filter(Finding::isError).toList();
    }

    private static String summarize(List<Finding> findings) {
        List<Finding> errors = findings.stream().filter(Finding::isError).toList();
        if (errors.isEmpty()) {
            return "Validation failed";
        }
        StringBuilder sb = new StringBuilder("Validation failed with ")
                .append(errors.size())
                .append(errors.size() == 1 ? " error: " : " errors: ");
        for (int i = 0; i < errors.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(errors.get(i).message());
        }
        return sb.toString();
    }

    private static int firstErrorLine(List<Finding> findings) {
        return findings.stream()
                .filter(Finding::isError)
                .mapToInt(Finding::line)
                .findFirst()
                .orElse(0);
    }
}
