package com.sopflow.compiler.ast;

public enum Scope {
    GLOBAL
}
