package com.sopflow.compiler.pipeline;

import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.augment.AugmentationClient;
import com.sopflow.compiler.augment.AugmentationOutcome;
import com.sopflow.compiler.augment.AugmentationStage;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.lexer.Lexer;
import com.sopflow.compiler.lexer.SourceNormalizer;
import com.sopflow.compiler.lexer.Token;
import com.sopflow.compiler.lexer.TokenKind;
import com.sopflow.compiler.optimizer.OptimizationResult;
import com.sopflow.compiler.optimizer.Optimizer;
import com.sopflow.compiler.parser.Parser;
import com.sopflow.compiler.semantic.AnalyzedWorkflow;
import com.sopflow.compiler.semantic.SemanticAnalyzer;
import com.sopflow.compiler.validation.ValidationResult;
import com.sopflow.compiler.validation.WorkflowValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one compilation unit through normalization, lexing, parsing, semantic analysis,
 * optional augmentation, validation and optimization. Every stage object is created for the
 * unit, so one compiler instance may serve concurrent calls.
 */
public class WorkflowCompiler {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final CompilerOptions options;
    private final AugmentationClient augmentationClient;

    public WorkflowCompiler(CompilerOptions options) {
        this(options, null);
    }

    public WorkflowCompiler(CompilerOptions options, AugmentationClient augmentationClient) {
        this.options = options;
        this.augmentationClient = augmentationClient;
    }

    public CompilationResult compile(String sourceName, String source) throws CompilationException {
        long startTime = System.currentTimeMillis();
        List<Finding> findings = new ArrayList<>();

        String normalized = new SourceNormalizer(options.tabWidth()).normalize(source);
        List<Token> tokens = new Lexer(sourceName).tokenize(normalized);
        WorkflowFile parsed = new Parser(sourceName, tokens).parse();
        logger.info("Parsed {}: {} tasks, {} variables", sourceName, parsed.tasks().size(), parsed.variables().size());

        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        AnalyzedWorkflow analyzed = analyzer.analyze(parsed);

        int augmentedTasks = 0;
        if (options.augment()) {
            try (AugmentationStage stage = new AugmentationStage(augmentationClient,
                    options.augmentationTimeout(), options.augmentationMandatory(), options.tabWidth())) {
                AugmentationOutcome outcome = stage.augment(analyzed.workflow());
                findings.addAll(outcome.warnings());
                augmentedTasks = outcome.tasksAugmented();
                if (augmentedTasks > 0) {
                    analyzed = analyzer.analyze(outcome.workflow());
                }
            }
        }
        findings.addAll(analyzed.warnings());

        ValidationResult validation = new WorkflowValidator(options.strictMode()).validate(analyzed.workflow());
        findings.addAll(validation.warnings());

        OptimizationResult optimization = new Optimizer().optimize(analyzed.workflow());

        logger.info("Compiled {} in {} ms: {} tasks kept, {} removed, {} warnings",
                sourceName, System.currentTimeMillis() - startTime,
                optimization.workflow().tasks().size(), optimization.report().tasksRemoved(), findings.size());

        return new CompilationResult(sourceName, countDirectives(tokens), optimization, findings, augmentedTasks);
    }

    private static Map<DirectiveKind, Integer> countDirectives(List<Token> tokens) {
        Map<DirectiveKind, Integer> counts = new EnumMap<>(DirectiveKind.class);
        for (Token token : tokens) {
            if (token.is(TokenKind.DIRECTIVE)) {
                counts.merge(token.directive(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
