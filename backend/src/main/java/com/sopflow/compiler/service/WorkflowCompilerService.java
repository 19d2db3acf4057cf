package com.sopflow.compiler.service;

import com.sopflow.compiler.augment.AugmentationClient;
import com.sopflow.compiler.config.SopCompilerProperties;
import com.sopflow.compiler.dto.CompileRequest;
import com.sopflow.compiler.dto.CompileResponse;
import com.sopflow.compiler.dto.WorkflowDocument;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.InternalCompilerException;
import com.sopflow.compiler.pipeline.CompilationResult;
import com.sopflow.compiler.pipeline.CompilerOptions;
import com.sopflow.compiler.pipeline.WorkflowCompiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class WorkflowCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCompilerService.class);

    private final SopCompilerProperties properties;
    private final WorkflowDocumentAssembler assembler;
    private final AugmentationClient augmentationClient;

    @Autowired
    public WorkflowCompilerService(SopCompilerProperties properties, WorkflowDocumentAssembler assembler,
                                   ObjectProvider<AugmentationClient> augmentationClient) {
        this(properties, assembler, augmentationClient.getIfAvailable());
    }

    WorkflowCompilerService(SopCompilerProperties properties, WorkflowDocumentAssembler assembler,
                            AugmentationClient augmentationClient) {
        this.properties = properties;
        this.assembler = assembler;
        this.augmentationClient = augmentationClient;
    }

    public CompileResponse compile(CompileRequest request) {
        String sourceCode = request.sourceCode();

        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            return CompileResponse.invalidRequest("Source code cannot be empty");
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return CompileResponse.invalidRequest(
                "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }

        String sourceName = request.effectiveSourceName();
        boolean strict = request.strict() != null ? request.strict() : properties.strictMode();
        long startTime = System.currentTimeMillis();

        try {
            CompilationResult result = new WorkflowCompiler(options(strict), augmentationClient)
                .compile(sourceName, sourceCode);
            WorkflowDocument document = assembler.assemble(result);
            return CompileResponse.success(document, System.currentTimeMillis() - startTime);

        } catch (CompilationException e) {
            logger.info("Compilation of {} failed at {} stage: {}", sourceName, e.getStage(), e.getMessage());
            return CompileResponse.failure(e, System.currentTimeMillis() - startTime);
        } catch (InternalCompilerException e) {
            logger.error("Internal compiler error for {}: {}", sourceName, e.getMessage(), e);
            return CompileResponse.internalError(
                "Internal compiler error: " + e.getMessage(), System.currentTimeMillis() - startTime);
        }
    }

    CompilerOptions options(boolean strict) {
        SopCompilerProperties.Augmentation augmentation = properties.augmentation();
        return new CompilerOptions(
            strict,
            properties.tabWidth(),
            augmentation.enabled(),
            augmentation.mandatory(),
            Duration.ofMillis(augmentation.timeoutMs()));
    }
}
