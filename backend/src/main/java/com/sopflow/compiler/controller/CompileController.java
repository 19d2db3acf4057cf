package com.sopflow.compiler.controller;

import com.sopflow.compiler.dto.CompileRequest;
import com.sopflow.compiler.dto.CompileResponse;
import com.sopflow.compiler.service.WorkflowCompilerService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class CompileController {

    private static final Logger logger = LoggerFactory.getLogger(CompileController.class);

    private final WorkflowCompilerService compilerService;

    public CompileController(WorkflowCompilerService compilerService) {
        this.compilerService = compilerService;
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        logger.info("Received compilation request for {} (length: {} chars)",
                   request.effectiveSourceName(),
                   request.sourceCode() != null ? request.sourceCode().length() : 0);

        try {
            CompileResponse response = compilerService.compile(request);

            logger.info("Compilation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            logger.error("Unexpected error during compilation: {}", e.getMessage(), e);

            CompileResponse errorResponse = CompileResponse.internalError(
                "Internal server error: " + e.getMessage(), 0
            );

            return ResponseEntity.internalServerError().body(errorResponse);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("SOP workflow compiler is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        CompileResponse response = CompileResponse.invalidRequest(errorMessage.toString());
        return ResponseEntity.badRequest().body(response);
    }
}
