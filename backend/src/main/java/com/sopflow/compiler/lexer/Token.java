package com.sopflow.compiler.lexer;

/**
 * One lexical unit.
 *
 * @param kind      token kind
 * @param directive keyword of a {@link TokenKind#DIRECTIVE} token, {@code null} otherwise
 * @param text      directive argument text, or the text line without its indentation
 * @param line      1-based source line
 * @param depth     number of open indentation levels at this token
 */
public record Token(TokenKind kind, DirectiveKind directive, String text, int line, int depth) {

    public static Token directive(DirectiveKind directive, String argument, int line, int depth) {
        return new Token(TokenKind.DIRECTIVE, directive, argument, line, depth);
    }

    public static Token text(String content, int line, int depth) {
        return new Token(TokenKind.TEXT, null, content, line, depth);
    }

    public static Token indent(int line, int depth) {
        return new Token(TokenKind.INDENT, null, "", line, depth);
    }

    public static Token dedent(int line, int depth) {
        return new Token(TokenKind.DEDENT, null, "", line, depth);
    }

    public static Token eof(int line) {
        return new Token(TokenKind.EOF, null, "", line, 0);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean is(DirectiveKind expected) {
        return kind == TokenKind.DIRECTIVE && directive == expected;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case DIRECTIVE -> directive + (text.isEmpty() ? "" : " " + text) + " @" + line;
            case TEXT -> "TEXT(" + text + ") @" + line;
            case INDENT, DEDENT, EOF -> kind + " @" + line;
        };
    }
}
