package com.sopflow.compiler.lexer;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of directive keywords. Adding a directive means adding a constant here and
 * handling it in every switch over this type.
 */
public enum DirectiveKind {
    VAR("var"),
    TASK("task"),
    TOOL("tool"),
    AGENT("agent"),
    IF("if"),
    ELSE("else"),
    NEXT("next"),
    LANG("lang");

    public static final char SIGIL = '@';

    private final String keyword;

    DirectiveKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<DirectiveKind> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(kind -> kind.keyword.equals(keyword))
                .findFirst();
    }

    @Override
    public String toString() {
        return SIGIL + keyword;
    }
}
