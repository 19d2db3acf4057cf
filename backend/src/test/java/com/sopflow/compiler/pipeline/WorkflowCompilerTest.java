package com.sopflow.compiler.pipeline;

import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.BodyItems;
import com.sopflow.compiler.ast.NextAction;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.Terminal;
import com.sopflow.compiler.ast.Transfer;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.augment.AugmentationResponse;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.CompilationStage;
import com.sopflow.compiler.exception.LexicalException;
import com.sopflow.compiler.exception.SemanticException;
import com.sopflow.compiler.exception.ValidationException;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.validation.WorkflowGraph;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowCompilerTest {

    private final WorkflowCompiler compiler = new WorkflowCompiler(CompilerOptions.defaults());

    @Test
    void compile_shouldFoldConstantConditionIntoDirectTerminalEdge() throws CompilationException {
        CompilationResult result = compiler.compile("a.sop", """
                @var x = 5
                @task A
                    @if x == 5
                        @next END
                    @else
                        @next B
                @task B
                    @next END
                """);

        List<BodyItem> body = result.optimization().workflow().tasks().get(0).body();
        assertEquals(List.of(new NextAction("END", 4)), body);
        assertEquals(List.of("END"), WorkflowGraph.of(result.optimization().workflow()).successors("A"));
    }

    @Test
    void compile_shouldReportIncompleteFlowForCycleWithoutExit() {
        ValidationException e = assertThrows(ValidationException.class, () -> compiler.compile("b.sop", """
                @task A
                    @next B
                @task B
                    @next A
                """));

        assertEquals(CompilationStage.VALIDATION, e.getStage());
        assertEquals(List.of("A", "B"), e.getErrors().stream()
                .filter(finding -> finding.code() == FindingCode.INCOMPLETE_FLOW)
                .map(Finding::taskId)
                .toList());
    }

    @Test
    void compile_shouldRejectUndeclaredPlaceholder() {
        SemanticException e = assertThrows(SemanticException.class, () -> compiler.compile("c.sop", """
                @task A
                    Greet the user
                    Send mail to {{undeclared}}
                    @next END
                """));

        assertEquals(SemanticException.Code.UNDECLARED_VARIABLE_REFERENCE, e.getCode());
        assertEquals(3, e.getLine());
    }

    @Test
    void compile_shouldRejectDuplicateTask() {
        SemanticException e = assertThrows(SemanticException.class, () -> compiler.compile("d.sop", """
                @task A
                    @next END
                @task A
                    @next END
                """));

        assertEquals(SemanticException.Code.DUPLICATE_TASK, e.getCode());
        assertEquals(3, e.getLine());
    }

    @Test
    void compile_shouldRouteBranchWithoutTransferToTrailingNext() throws CompilationException {
        CompilationResult result = compiler.compile("e.sop", """
                @task A
                    @if user.ok
                        Say hello
                    @next C
                @task C
                    @next END
                """);

        assertEquals(List.of("C"), WorkflowGraph.of(result.optimization().workflow()).successors("A"));
    }

    @Test
    void compile_shouldCountDirectives() throws CompilationException {
        CompilationResult result = compiler.compile("counts.sop", """
                @lang en
                @var x = 5
                @task A
                    @tool crm Look up the customer
                    @if x > 3
                        @next B
                    @else
                        @next END
                @task B
                    @agent Mailer(to=ops)
                    @next END
                """);

        assertEquals(1, result.directiveCounts().get(DirectiveKind.LANG));
        assertEquals(1, result.directiveCounts().get(DirectiveKind.VAR));
        assertEquals(2, result.directiveCounts().get(DirectiveKind.TASK));
        assertEquals(1, result.directiveCounts().get(DirectiveKind.TOOL));
        assertEquals(1, result.directiveCounts().get(DirectiveKind.AGENT));
        assertEquals(1, result.directiveCounts().get(DirectiveKind.IF));
        assertEquals(1, result.directiveCounts().get(DirectiveKind.ELSE));
        assertEquals(3, result.directiveCounts().get(DirectiveKind.NEXT));
    }

    @Test
    void compile_shouldBeDeterministic() throws CompilationException {
        String source = """
                @var retries = 3
                @task start
                    Collect the ticket
                    Check priority
                    @if retries > 5
                        @next escalate
                    @next finish
                @task escalate
                    @tool pager Page the on-call engineer
                    @next finish
                @task finish
                    @next END
                """;

        CompilationResult first = compiler.compile("same.sop", source);
        CompilationResult second = compiler.compile("same.sop", source);

        assertEquals(first, second);
    }

    @Test
    void compile_shouldPropagateLexicalErrors() {
        LexicalException e = assertThrows(LexicalException.class, () -> compiler.compile("lex.sop", """
                @task A
                    @frobnicate now
                """));

        assertEquals(CompilationStage.LEXICAL, e.getStage());
        assertEquals(2, e.getLine());
    }

    @Test
    void compile_shouldCollectWarningsInStageOrder() throws CompilationException {
        WorkflowCompiler augmenting = new WorkflowCompiler(
                CompilerOptions.defaults().withAugmentation(true, false, Duration.ofSeconds(5)));

        CompilationResult result = augmenting.compile("warnings.sop", """
                @task A
                    Hello
                    @next END
                @task B
                """);

        assertEquals(List.of(FindingCode.AUGMENTATION_DEGRADED, FindingCode.EMPTY_TASK_BODY,
                        FindingCode.UNREACHABLE_TASK),
                result.findings().stream().map(Finding::code).toList());
    }

    @Test
    void compile_shouldReportUnreachableTaskAsErrorInStrictMode() {
        WorkflowCompiler strict = new WorkflowCompiler(CompilerOptions.defaults().withStrictMode(true));

        ValidationException e = assertThrows(ValidationException.class, () -> strict.compile("strict.sop", """
                @task A
                    @next END
                @task B
                    @next END
                """));

        assertEquals(FindingCode.UNREACHABLE_TASK, e.getErrors().get(0).code());
    }

    @Test
    void compile_shouldReanalyzeAugmentedWorkflow() {
        WorkflowCompiler augmenting = new WorkflowCompiler(
                CompilerOptions.defaults().withAugmentation(true, false, Duration.ofSeconds(5)),
                request -> AugmentationResponse.rewritten("Greet {{undeclared}}\n@next END"));

        SemanticException e = assertThrows(SemanticException.class, () -> augmenting.compile("aug.sop", """
                @task A
                    Greet the customer
                    @next END
                """));

        assertEquals(SemanticException.Code.UNDECLARED_VARIABLE_REFERENCE, e.getCode());
    }

    @Test
    void compile_shouldCountAugmentedTasks() throws CompilationException {
        WorkflowCompiler augmenting = new WorkflowCompiler(
                CompilerOptions.defaults().withAugmentation(true, false, Duration.ofSeconds(5)),
                request -> AugmentationResponse.rewritten("@tool crm Greet the customer\n@next END"));

        CompilationResult result = augmenting.compile("aug.sop", """
                @task A
                    Greet the customer
                    @next END
                """);

        assertEquals(1, result.augmentedTasks());
        assertEquals(List.of("crm"), result.optimization().tools().stream().map(tool -> tool.name()).toList());
    }

    @Test
    void compile_shouldEndTaskWhoseOnlyConditionalFoldsAway() throws CompilationException {
        CompilationResult result = compiler.compile("fold.sop", """
                @var x = 1
                @task A
                    @if x == 2
                        never happens
                """);

        assertEquals(List.of(new NextAction("END", 3)), result.optimization().workflow().tasks().get(0).body());
    }

    @Test
    void compile_shouldLeaveOnlyReachableTasksAndResolvableTransfers() throws CompilationException {
        CompilationResult result = compiler.compile("invariants.sop", """
                @var mode = "auto"
                @task start
                    Read the request
                    @if mode == "manual"
                        @next review
                    @else
                        @next dispatch
                @task review
                    @next dispatch
                @task dispatch
                    @if ticket.urgent
                        @next END
                    @next archive
                @task archive
                    @next END
                @task legacy
                    @next archive
                """);

        WorkflowFile optimized = result.optimization().workflow();
        Set<String> survivors = optimized.tasks().stream().map(TaskDecl::id).collect(Collectors.toSet());
        assertEquals(Set.of("start", "dispatch", "archive"), survivors);
        assertEquals(List.of("legacy", "review"), result.optimization().report().removedTasks());

        for (TaskDecl task : optimized.tasks()) {
            for (Transfer transfer : BodyItems.transfers(task.body())) {
                assertTrue(Terminal.is(transfer.target()) || survivors.contains(transfer.target()),
                        task.id() + " jumps to " + transfer.target());
            }
        }
        Set<String> reachable = WorkflowGraph.of(optimized).reachableFrom(optimized.entryPoint());
        assertTrue(reachable.containsAll(survivors));
        assertEquals(FindingCode.UNREACHABLE_TASK, result.findings().get(0).code());
    }
}
