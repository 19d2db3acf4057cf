package com.sopflow.compiler.augment;

import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.NextAction;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.AugmentationException;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.lexer.Lexer;
import com.sopflow.compiler.parser.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AugmentationStageTest {

    private static final String SOURCE = """
            @task check
                Look up the customer in the CRM
                @next END
            """;

    @Mock
    private AugmentationClient client;

    private AugmentationStage stage;

    @AfterEach
    void tearDown() {
        if (stage != null) {
            stage.close();
        }
    }

    private static WorkflowFile parse(String source) throws CompilationException {
        return new Parser("test.sop", new Lexer("test.sop").tokenize(source)).parse();
    }

    private AugmentationStage stage(Duration timeout, boolean mandatory) {
        stage = new AugmentationStage(client, timeout, mandatory, 4);
        return stage;
    }

    @Test
    void augment_shouldReplaceBodyWithParsedFragment() throws Exception {
        when(client.augment(any())).thenReturn(AugmentationResponse.rewritten("""
                @tool crm Look up the customer
                @if customer.found
                    @next END
                @else
                    Ask for the customer id
                @next END
                """));

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(parse(SOURCE));

        assertFalse(outcome.degraded());
        assertEquals(1, outcome.tasksAugmented());
        List<BodyItem> body = outcome.workflow().tasks().get(0).body();
        assertEquals(3, body.size());
        assertEquals("crm", assertInstanceOf(ToolCall.class, body.get(0)).name());
        assertEquals(2, assertInstanceOf(Conditional.class, body.get(1)).branches().size());
        assertEquals("END", assertInstanceOf(NextAction.class, body.get(2)).target());
    }

    @Test
    void augment_shouldSendBodyWrittenAsDsl() throws Exception {
        when(client.augment(any())).thenReturn(AugmentationResponse.unchanged());

        stage(Duration.ofSeconds(5), false).augment(parse(SOURCE));

        ArgumentCaptor<AugmentationRequest> captor = ArgumentCaptor.forClass(AugmentationRequest.class);
        verify(client).augment(captor.capture());
        assertEquals("check", captor.getValue().key());
        assertEquals("Look up the customer in the CRM\n@next END\n", captor.getValue().text());
        assertEquals(Duration.ofSeconds(5), captor.getValue().timeout());
    }

    @Test
    void augment_shouldKeepBodyWhenResponseIsUnchanged() throws Exception {
        when(client.augment(any())).thenReturn(AugmentationResponse.unchanged());
        WorkflowFile input = parse(SOURCE);

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(input);

        assertEquals(input, outcome.workflow());
        assertEquals(0, outcome.tasksAugmented());
        assertFalse(outcome.degraded());
    }

    @Test
    void augment_shouldNotSendTasksWithoutFreeText() throws Exception {
        WorkflowFile input = parse("""
                @task check
                    @tool crm Look up the customer
                    @next END
                """);

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(input);

        verifyNoInteractions(client);
        assertEquals(input, outcome.workflow());
    }

    @Test
    void augment_shouldDegradeOnTimeout() throws Exception {
        when(client.augment(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return AugmentationResponse.rewritten("never used");
        });
        WorkflowFile input = parse(SOURCE);

        AugmentationOutcome outcome = stage(Duration.ofMillis(50), false).augment(input);

        assertSame(input, outcome.workflow());
        assertTrue(outcome.degraded());
        assertEquals(FindingCode.AUGMENTATION_DEGRADED, outcome.warnings().get(0).code());
        assertTrue(outcome.warnings().get(0).message().contains("timed out"));
    }

    @Test
    void augment_shouldDegradeWhenClientFails() throws Exception {
        when(client.augment(any())).thenThrow(new IOException("connection refused"));
        WorkflowFile input = parse(SOURCE);

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(input);

        assertSame(input, outcome.workflow());
        assertTrue(outcome.warnings().get(0).message().contains("connection refused"));
    }

    @Test
    void augment_shouldDegradeOnMalformedFragment() throws Exception {
        when(client.augment(any())).thenReturn(AugmentationResponse.rewritten("""
                Check the account
                @task other
                    @next END
                """));
        WorkflowFile input = parse(SOURCE);

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(input);

        assertSame(input, outcome.workflow());
        assertEquals(1, outcome.warnings().size());
        assertTrue(outcome.warnings().get(0).message().contains("malformed fragment"));
    }

    @Test
    void augment_shouldDegradeWholeUnitWhenOneTaskFails() throws Exception {
        when(client.augment(any()))
                .thenReturn(AugmentationResponse.rewritten("Rewritten\n@next second"))
                .thenThrow(new IOException("quota exceeded"));
        WorkflowFile input = parse("""
                @task first
                    Do the first thing
                    @next second
                @task second
                    Do the second thing
                    @next END
                """);

        AugmentationOutcome outcome = stage(Duration.ofSeconds(5), false).augment(input);

        verify(client, times(2)).augment(any());
        assertSame(input, outcome.workflow());
        assertEquals(0, outcome.tasksAugmented());
    }

    @Test
    void augment_shouldFailWhenMandatoryAndClientFails() throws Exception {
        when(client.augment(any())).thenThrow(new IOException("connection refused"));
        WorkflowFile input = parse(SOURCE);
        AugmentationStage mandatoryStage = stage(Duration.ofSeconds(5), true);

        AugmentationException e = assertThrows(AugmentationException.class, () -> mandatoryStage.augment(input));
        assertTrue(e.getMessage().contains("mandatory"));
    }

    @Test
    void augment_shouldDegradeWithoutClient() throws CompilationException {
        stage = new AugmentationStage(null, Duration.ofSeconds(5), false, 4);
        WorkflowFile input = parse(SOURCE);

        AugmentationOutcome outcome = stage.augment(input);

        assertSame(input, outcome.workflow());
        assertTrue(outcome.warnings().get(0).message().contains("no augmentation client"));
    }

    @Test
    void parseFragment_shouldAcceptTabsAndNestedBlocks() throws CompilationException {
        stage = new AugmentationStage(client, Duration.ofSeconds(5), false, 4);
        WorkflowFile input = parse(SOURCE);

        List<BodyItem> body = stage.parseFragment(input.tasks().get(0), "@if ready\n\tGo\n@next END");

        Conditional conditional = assertInstanceOf(Conditional.class, body.get(0));
        assertEquals(List.of(new TextLine("Go", 3)), conditional.branches().get(0).body());
    }
}
