package com.sopflow.compiler.lexer;

import com.sopflow.compiler.exception.LexicalException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexerTest {

    private final Lexer lexer = new Lexer("test.sop");

    @Test
    void tokenize_shouldEmitDirectivesTextAndIndentation() throws LexicalException {
        List<Token> tokens = lexer.tokenize("""
                @var x = 5
                @task a Title
                    hello {{x}}
                    @next END
                """);

        assertEquals(List.of(
                Token.directive(DirectiveKind.VAR, "x = 5", 1, 0),
                Token.directive(DirectiveKind.TASK, "a Title", 2, 0),
                Token.indent(3, 1),
                Token.text("hello {{x}}", 3, 1),
                Token.directive(DirectiveKind.NEXT, "END", 4, 1),
                Token.dedent(4, 0),
                Token.eof(5)
        ), tokens);
    }

    @Test
    void tokenize_shouldSkipBlankAndCommentLinesWithoutChangingIndentation() throws LexicalException {
        List<Token> tokens = lexer.tokenize("@task a\n    one\n\n# note\n    two\n");

        assertEquals(List.of(TokenKind.DIRECTIVE, TokenKind.INDENT, TokenKind.TEXT, TokenKind.TEXT,
                TokenKind.DEDENT, TokenKind.EOF), tokens.stream().map(Token::kind).toList());
        assertEquals("two", tokens.get(3).text());
        assertEquals(5, tokens.get(3).line());
    }

    @Test
    void tokenize_shouldEmitOneDedentPerClosedLevel() throws LexicalException {
        List<Token> tokens = lexer.tokenize("@task a\n    @if x\n        deep\n@task b\n");

        assertEquals(List.of(TokenKind.DIRECTIVE, TokenKind.INDENT, TokenKind.DIRECTIVE, TokenKind.INDENT,
                TokenKind.TEXT, TokenKind.DEDENT, TokenKind.DEDENT, TokenKind.DIRECTIVE, TokenKind.EOF),
                tokens.stream().map(Token::kind).toList());
        assertEquals(4, tokens.get(5).line());
        assertEquals(1, tokens.get(5).depth());
        assertEquals(0, tokens.get(6).depth());
    }

    @Test
    void tokenize_shouldRejectIndentationMatchingNoEnclosingLevel() {
        LexicalException e = assertThrows(LexicalException.class,
                () -> lexer.tokenize("@task a\n    one\n  two\n"));

        assertEquals(3, e.getLine());
    }

    @Test
    void tokenize_shouldRejectTabInIndentation() {
        LexicalException e = assertThrows(LexicalException.class, () -> lexer.tokenize("@task a\n\tone\n"));

        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("Tab"));
    }

    @Test
    void tokenize_shouldRejectUnknownDirective() {
        LexicalException e = assertThrows(LexicalException.class, () -> lexer.tokenize("@foo bar"));

        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().contains("@foo"));
    }

    @Test
    void tokenize_shouldRejectKeywordGluedToOtherCharacters() {
        assertThrows(LexicalException.class, () -> lexer.tokenize("@task:verify"));
    }

    @Test
    void tokenize_shouldTreatSigilNotFollowedByLetterAsText() throws LexicalException {
        List<Token> tokens = lexer.tokenize("@ mention\n@123 ticket");

        assertEquals(Token.text("@ mention", 1, 0), tokens.get(0));
        assertEquals(Token.text("@123 ticket", 2, 0), tokens.get(1));
    }

    @Test
    void tokenize_shouldReturnImmutableList() throws LexicalException {
        List<Token> tokens = lexer.tokenize("@task a");

        assertThrows(UnsupportedOperationException.class, () -> tokens.add(Token.eof(9)));
        assertEquals(2, tokens.size());
    }
}
