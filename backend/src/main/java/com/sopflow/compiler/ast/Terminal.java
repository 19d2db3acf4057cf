package com.sopflow.compiler.ast;

public final class Terminal {

    public static final String MARKER = "END";

    private Terminal() {
    }

    public static boolean is(String id) {
        return MARKER.equals(id);
    }
}
