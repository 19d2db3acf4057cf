package com.sopflow.compiler.ast;

public record AgentParameter(String key, String value) {
}
