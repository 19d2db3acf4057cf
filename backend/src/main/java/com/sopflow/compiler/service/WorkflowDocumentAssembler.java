package com.sopflow.compiler.service;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.AgentParameter;
import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.Transfer;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.config.SopCompilerProperties;
import com.sopflow.compiler.dto.WorkflowDocument;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.pipeline.CompilationResult;
import com.sopflow.compiler.validation.WorkflowGraph;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link WorkflowDocument} for a compiled unit.
 */
@Component
public class WorkflowDocumentAssembler {

    private final SopCompilerProperties properties;
    private final Clock clock;

    public WorkflowDocumentAssembler(SopCompilerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public WorkflowDocument assemble(CompilationResult result) {
        WorkflowFile workflow = result.optimization().workflow();
        WorkflowGraph graph = WorkflowGraph.of(workflow);
        List<String> sourceFiles = List.of(result.sourceName());

        Map<String, Integer> directiveCounts = new LinkedHashMap<>();
        for (DirectiveKind kind : DirectiveKind.values()) {
            directiveCounts.put(kind.toString(), result.directiveCounts().getOrDefault(kind, 0));
        }

        WorkflowDocument.Metadata metadata = new WorkflowDocument.Metadata(
                directiveCounts,
                sourceFiles,
                Instant.now(clock).toString(),
                workflow.language(),
                workflow.preamble().stream().map(TextLine::content).toList(),
                result.augmentedTasks(),
                result.optimization().report());

        List<WorkflowDocument.Variable> variables = new ArrayList<>();
        for (VariableDecl variable : workflow.variables()) {
            variables.add(new WorkflowDocument.Variable(variable.name(), variable.value(), variable.type(),
                    variable.scope() == null ? null : variable.scope().name().toLowerCase(Locale.ROOT)));
        }

        List<WorkflowDocument.Task> tasks = new ArrayList<>();
        for (TaskDecl task : workflow.tasks()) {
            tasks.add(new WorkflowDocument.Task(
                    task.id(),
                    task.title(),
                    blocks(task.body()),
                    graph.successors(task.id()),
                    graph.predecessors(task.id()),
                    new WorkflowDocument.TaskMetadata(task.line())));
        }

        return new WorkflowDocument(
                WorkflowDocument.FORMAT_VERSION,
                metadata,
                variables,
                result.optimization().tools(),
                tasks,
                workflow.entryPoint(),
                properties.compilerVersion(),
                sourceFiles,
                result.findings());
    }

    private List<WorkflowDocument.Block> blocks(List<BodyItem> body) {
        List<WorkflowDocument.Block> blocks = new ArrayList<>();
        for (BodyItem item : body) {
            blocks.add(switch (item.kind()) {
                case TEXT -> WorkflowDocument.Block.text(((TextLine) item).content(), item.line());
                case TOOL_CALL -> {
                    ToolCall call = (ToolCall) item;
                    yield WorkflowDocument.Block.tool(call.name(), call.description(), call.line());
                }
                case AGENT_CALL -> {
                    AgentCall call = (AgentCall) item;
                    Map<String, String> parameters = new LinkedHashMap<>();
                    for (AgentParameter parameter : call.parameters()) {
                        parameters.put(parameter.key(), parameter.value());
                    }
                    yield WorkflowDocument.Block.agent(call.name(), parameters, call.line());
                }
                case CONDITIONAL -> WorkflowDocument.Block.conditional(
                        ((Conditional) item).branches().stream()
                                .map(branch -> new WorkflowDocument.Branch(
                                        branch.condition(), branch.isElse(), blocks(branch.body())))
                                .toList(),
                        item.line());
                case JUMP -> WorkflowDocument.Block.jump(((Transfer) item).target(), item.line());
                case NEXT_ACTION -> WorkflowDocument.Block.next(((Transfer) item).target(), item.line());
            });
        }
        return blocks;
    }
}
