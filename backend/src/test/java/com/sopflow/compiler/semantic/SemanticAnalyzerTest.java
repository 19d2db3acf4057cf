package com.sopflow.compiler.semantic;

import com.sopflow.compiler.ast.Scope;
import com.sopflow.compiler.ast.ValueType;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.diagnostics.Finding;
import com.sopflow.compiler.diagnostics.FindingCode;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.SemanticException;
import com.sopflow.compiler.lexer.Lexer;
import com.sopflow.compiler.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticAnalyzerTest {

    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();

    private AnalyzedWorkflow analyze(String source) throws CompilationException {
        return analyzer.analyze(new Parser("test.sop", new Lexer("test.sop").tokenize(source)).parse());
    }

    @Test
    void analyze_shouldInferVariableTypesFromLiteralShape() throws CompilationException {
        AnalyzedWorkflow result = analyze("""
                @var count = 5
                @var ratio = 2.5
                @var enabled = TRUE
                @var greeting = "hello there"
                @var mode = fast
                @var quoted = 'x'
                @task a
                    @next END
                """);

        List<VariableDecl> variables = result.workflow().variables();
        assertEquals(5L, variables.get(0).value());
        assertEquals(ValueType.INTEGER, variables.get(0).type());
        assertEquals(2.5, variables.get(1).value());
        assertEquals(ValueType.FLOAT, variables.get(1).type());
        assertEquals(Boolean.TRUE, variables.get(2).value());
        assertEquals(ValueType.BOOLEAN, variables.get(2).type());
        assertEquals("hello there", variables.get(3).value());
        assertEquals(ValueType.STRING, variables.get(3).type());
        assertEquals("fast", variables.get(4).value());
        assertEquals("x", variables.get(5).value());
        assertTrue(variables.stream().allMatch(variable -> variable.scope() == Scope.GLOBAL));
        assertTrue(result.symbols().hasVariable("ratio"));
    }

    @Test
    void analyze_shouldRejectDuplicateVariable() {
        SemanticException e = assertThrows(SemanticException.class,
                () -> analyze("@var x = 1\n@var x = 2\n@task a\n    @next END\n"));

        assertEquals(SemanticException.Code.DUPLICATE_VARIABLE, e.getCode());
        assertEquals(2, e.getLine());
    }

    @Test
    void analyze_shouldRejectDuplicateTask() {
        SemanticException e = assertThrows(SemanticException.class,
                () -> analyze("@task A\n    one\n@task A\n    two\n"));

        assertEquals(SemanticException.Code.DUPLICATE_TASK, e.getCode());
        assertEquals(3, e.getLine());
    }

    @Test
    void analyze_shouldRejectUndeclaredReferenceWithItsLine() {
        SemanticException e = assertThrows(SemanticException.class,
                () -> analyze("@var name = bob\n@task a\n    Hello {{name}}\n    Ticket {{undeclared}}\n"));

        assertEquals(SemanticException.Code.UNDECLARED_VARIABLE_REFERENCE, e.getCode());
        assertEquals(4, e.getLine());
        assertTrue(e.getMessage().contains("undeclared"));
    }

    @Test
    void analyze_shouldCheckReferencesInToolsAgentsAndConditions() {
        assertThrows(SemanticException.class, () -> analyze("@task a\n    @tool db Look up {{who}}\n"));
        assertThrows(SemanticException.class, () -> analyze("@task a\n    @agent Mail(to={{who}})\n"));
        assertThrows(SemanticException.class, () -> analyze("@task a\n    @if {{who}} == 1\n        x\n"));
    }

    @Test
    void analyze_shouldLeaveBareConditionIdentifiersUnresolved() throws CompilationException {
        AnalyzedWorkflow result = analyze("@task a\n    @if user.verified and attempts < 3\n        ok\n");

        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void analyze_shouldRejectInvalidLiterals() {
        SemanticException missing = assertThrows(SemanticException.class, () -> analyze("@var x\n"));
        assertEquals(SemanticException.Code.INVALID_LITERAL, missing.getCode());
        assertEquals(1, missing.getLine());

        SemanticException unbalanced = assertThrows(SemanticException.class, () -> analyze("@var x = \"open\n"));
        assertEquals(SemanticException.Code.INVALID_LITERAL, unbalanced.getCode());

        assertThrows(SemanticException.class, () -> analyze("@var x = null\n"));
    }

    @Test
    void analyze_shouldDeriveDefaultTitleFromId() throws CompilationException {
        AnalyzedWorkflow result = analyze("@task verify_user\n    x\n@task b Custom title\n    y\n");

        assertEquals("Verify User", result.workflow().tasks().get(0).title());
        assertEquals("Custom title", result.workflow().tasks().get(1).title());
    }

    @Test
    void analyze_shouldWarnAboutEmptyTaskBody() throws CompilationException {
        AnalyzedWorkflow result = analyze("@task a\n@task b\n    x\n");

        assertEquals(1, result.warnings().size());
        Finding warning = result.warnings().get(0);
        assertEquals(FindingCode.EMPTY_TASK_BODY, warning.code());
        assertEquals("a", warning.taskId());
    }

    @Test
    void analyze_shouldWarnAboutConflictingToolDeclarations() throws CompilationException {
        AnalyzedWorkflow result = analyze("""
                @task a
                    @tool db Query users
                    @tool db Query users
                    @agent Mail(to=x)
                @task b
                    @tool db Delete users
                    @agent Mail(to=y, cc=z)
                """);

        List<FindingCode> codes = result.warnings().stream().map(Finding::code).toList();
        assertEquals(List.of(FindingCode.CONFLICTING_TOOL_DECLARATION, FindingCode.CONFLICTING_TOOL_DECLARATION), codes);
        assertEquals(6, result.warnings().get(0).line());
        assertEquals("Query users", result.symbols().tool("db").orElseThrow().description());
        assertEquals(List.of("to"), result.symbols().tool("Mail").orElseThrow().parameterKeys());
    }
}
