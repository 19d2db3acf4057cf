package com.sopflow.compiler.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
