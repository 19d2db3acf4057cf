package com.sopflow.compiler.controller;

import com.sopflow.compiler.dto.SyntaxAnalysisRequest;
import com.sopflow.compiler.dto.SyntaxAnalysisResponse;
import com.sopflow.compiler.service.WorkflowSyntaxAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);

    private final WorkflowSyntaxAnalysisService syntaxAnalysisService;

    public SyntaxAnalysisController(WorkflowSyntaxAnalysisService syntaxAnalysisService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyzeSyntax(@Valid @RequestBody SyntaxAnalysisRequest request) {
        logger.debug("Received syntax analysis request for {} characters",
            request.sourceCode().length());

        SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);

        logger.debug("Syntax analysis completed: success={}, tokens={}",
            response.success(), response.tokens().size());

        return ResponseEntity.ok(response);
    }
}
