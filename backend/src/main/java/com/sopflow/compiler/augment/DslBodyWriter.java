package com.sopflow.compiler.augment;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.Branch;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.Transfer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a task body back out as DSL text, four spaces per nesting level, starting at column 0.
 */
public final class DslBodyWriter {

    private static final String INDENT = "    ";

    private DslBodyWriter() {
    }

    public static String write(List<BodyItem> body) {
        StringBuilder sb = new StringBuilder();
        write(body, 0, sb);
        return sb.toString();
    }

    private static void write(List<BodyItem> body, int depth, StringBuilder sb) {
        String indent = INDENT.repeat(depth);
        for (BodyItem item : body) {
            switch (item.kind()) {
                case TEXT -> {
                    for (String line : ((TextLine) item).content().split("\n")) {
                        sb.append(indent).append(line).append('\n');
                    }
                }
                case TOOL_CALL -> {
                    ToolCall call = (ToolCall) item;
                    sb.append(indent).append("@tool ").append(call.name());
                    if (call.description() != null) {
                        sb.append(' ').append(call.description());
                    }
                    sb.append('\n');
                }
                case AGENT_CALL -> {
                    AgentCall call = (AgentCall) item;
                    sb.append(indent).append("@agent ").append(call.name());
                    if (!call.parameters().isEmpty()) {
                        sb.append(call.parameters().stream()
                                .map(parameter -> parameter.key() + "=" + parameter.value())
                                .collect(Collectors.joining(", ", "(", ")")));
                    }
                    sb.append('\n');
                }
                case CONDITIONAL -> {
                    for (Branch branch : ((Conditional) item).branches()) {
                        sb.append(indent).append(branch.isElse() ? "@else" : "@if " + branch.condition()).append('\n');
                        write(branch.body(), depth + 1, sb);
                    }
                }
                case JUMP, NEXT_ACTION -> sb.append(indent).append("@next ")
                        .append(((Transfer) item).target()).append('\n');
            }
        }
    }
}
