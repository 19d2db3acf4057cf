package com.sopflow.compiler.ast;

import java.util.List;

public record AgentCall(String name, List<AgentParameter> parameters, int line) implements BodyItem {

    public AgentCall {
        parameters = List.copyOf(parameters);
    }

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.AGENT_CALL;
    }

    public List<String> parameterKeys() {
        return parameters.stream().map(AgentParameter::key).toList();
    }
}
