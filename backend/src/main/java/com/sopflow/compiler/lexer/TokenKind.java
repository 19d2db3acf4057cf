package com.sopflow.compiler.lexer;

public enum TokenKind {
    DIRECTIVE,
    TEXT,
    INDENT,
    DEDENT,
    EOF
}
