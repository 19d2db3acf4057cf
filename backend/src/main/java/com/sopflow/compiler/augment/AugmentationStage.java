package com.sopflow.compiler.augment;

import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.AugmentationException;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.CompilationStage;
import com.sopflow.compiler.lexer.Lexer;
import com.sopflow.compiler.lexer.SourceNormalizer;
import com.sopflow.compiler.parser.Parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends every task body that carries free text to the {@link AugmentationClient} and parses the
 * returned fragment as the new body.
 * <p>
 * Each call runs on the stage's own executor and is awaited for at most the configured timeout.
 * A missing client, a timeout, a failed call or a fragment that does not parse falls back to the
 * input workflow with an {@link FindingCode#AUGMENTATION_DEGRADED} warning, or fails the unit
 * when augmentation is mandatory.
 */
public class AugmentationStage implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AugmentationStage.class);

    private final AugmentationClient client;
    private final Duration timeout;
    private final boolean mandatory;
    private final int tabWidth;
    private final ExecutorService executor;

    public AugmentationStage(AugmentationClient client, Duration timeout, boolean mandatory, int tabWidth) {
        this.client = client;
        this.timeout = timeout;
        this.mandatory = mandatory;
        this.tabWidth = tabWidth;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sopflow-augmentation");
            thread.setDaemon(true);
            return thread;
        });
    }

    public AugmentationOutcome augment(WorkflowFile file) throws AugmentationException {
        if (client == null) {
            return degrade(file, "no augmentation client is configured", null);
        }

        List<TaskDecl> tasks = new ArrayList<>();
        int augmented = 0;
        for (TaskDecl task : file.tasks()) {
            if (!hasFreeText(task.body())) {
                tasks.add(task);
                continue;
            }

            AugmentationRequest request = new AugmentationRequest(task.id(), DslBodyWriter.write(task.body()), timeout);
            AugmentationResponse response;
            try {
                response = call(request);
            } catch (TimeoutException e) {
                return degrade(file, "augmentation of task '" + task.id() + "' timed out after "
                        + timeout.toMillis() + " ms", e);
            } catch (ExecutionException e) {
                return degrade(file, "augmentation of task '" + task.id() + "' failed: "
                        + e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AugmentationException("Interrupted while augmenting task '" + task.id() + "'", e);
            }

            if (response == null) {
                return degrade(file, "augmentation of task '" + task.id() + "' returned no response", null);
            }
            if (!response.changed()) {
                tasks.add(task);
                continue;
            }
            if (response.fragment() == null || response.fragment().isBlank()) {
                return degrade(file, "augmentation of task '" + task.id() + "' returned an empty fragment", null);
            }

            try {
                tasks.add(task.withBody(parseFragment(task, response.fragment())));
                augmented++;
            } catch (CompilationException e) {
                return degrade(file, "augmentation of task '" + task.id()
                        + "' returned a malformed fragment: " + e.getMessage(), e);
            }
        }

        logger.info("Augmented {} of {} tasks in {}", augmented, file.tasks().size(), file.sourceName());
        return new AugmentationOutcome(file.withTasks(tasks), List.of(), augmented);
    }

    private AugmentationResponse call(AugmentationRequest request)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<AugmentationResponse> future = executor.submit(() -> client.augment(request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Parses the fragment as the body of a task with the same id.
     */
    List<BodyItem> parseFragment(TaskDecl task, String fragment) throws CompilationException {
        String normalized = new SourceNormalizer(tabWidth).normalize(fragment);
        StringBuilder source = new StringBuilder("@task ").append(task.id()).append('\n');
        for (String line : normalized.split("\n", -1)) {
            source.append("    ").append(line).append('\n');
        }

        String sourceName = "augmentation:" + task.id();
        WorkflowFile parsed = new Parser(sourceName, new Lexer(sourceName).tokenize(source.toString())).parse();
        if (parsed.tasks().size() != 1 || parsed.tasks().get(0).body().isEmpty()) {
            throw new CompilationException(CompilationStage.AUGMENTATION,
                    "fragment does not form a single task body", 0);
        }
        return parsed.tasks().get(0).body();
    }

    private AugmentationOutcome degrade(WorkflowFile file, String reason, Throwable cause)
            throws AugmentationException {
        if (mandatory) {
            throw cause == null
                    ? new AugmentationException("Augmentation is mandatory but " + reason)
                    : new AugmentationException("Augmentation is mandatory but " + reason, cause);
        }
        logger.warn("Falling back to the unaugmented workflow for {}: {}", file.sourceName(), reason);
        Finding warning = Finding.warning(FindingCode.AUGMENTATION_DEGRADED,
                "Augmentation skipped: " + reason, null, 0);
        return new AugmentationOutcome(file, List.of(warning), 0);
    }

    private static boolean hasFreeText(List<BodyItem> body) {
        return body.stream().anyMatch(TextLine.class::isInstance);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
