package com.sopflow.compiler.validation;

import com.sopflow.compiler.ast.BodyItems;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.Terminal;
import com.sopflow.compiler.ast.Transfer;
import com.sopflow.compiler.ast.WorkflowFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed graph over task ids and the terminal. Cycles are allowed.
 * <p>
 * Every transfer written anywhere in a task body is an edge; a task whose body can finish
 * without a transfer also gets an implicit edge to the terminal. The terminal task itself never
 * gets an implicit edge.
 */
public final class WorkflowGraph {

    private final Set<String> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incoming = new LinkedHashMap<>();

    private WorkflowGraph(Set<String> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableSet(nodes);
        this.edges = List.copyOf(edges);
        for (Edge edge : this.edges) {
            outgoing.computeIfAbsent(edge.from(), id -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.to(), id -> new ArrayList<>()).add(edge);
        }
    }

    public static WorkflowGraph of(WorkflowFile file) {
        Set<String> nodes = new LinkedHashSet<>();
        List<Edge> edges = new ArrayList<>();
        for (TaskDecl task : file.tasks()) {
            nodes.add(task.id());
        }
        nodes.add(Terminal.MARKER);

        for (TaskDecl task : file.tasks()) {
            for (Transfer transfer : BodyItems.transfers(task.body())) {
                edges.add(new Edge(task.id(), transfer.target(), transfer.line(), false));
            }
            if (!task.isTerminal() && BodyItems.mayFallThrough(task.body())) {
                edges.add(new Edge(task.id(), Terminal.MARKER, task.line(), true));
            }
        }
        return new WorkflowGraph(nodes, edges);
    }

    public Set<String> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public boolean contains(String id) {
        return nodes.contains(id);
    }

    public List<Edge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Edge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Distinct successor ids in edge order.
     */
    public List<String> successors(String id) {
        return distinct(outgoing(id), Edge::to);
    }

    /**
     * Distinct predecessor ids in edge order.
     */
    public List<String> predecessors(String id) {
        return distinct(incoming(id), Edge::from);
    }

    /**
     * Nodes reachable from {@code start} along edges, {@code start} included. Edges to unknown
     * nodes are not followed.
     */
    public Set<String> reachableFrom(String start) {
        return search(start, this::successors);
    }

    /**
     * Nodes from which {@code target} is reachable, {@code target} included.
     */
    public Set<String> reaching(String target) {
        return search(target, this::predecessors);
    }

    private Set<String> search(String start, Function<String, List<String>> next) {
        Set<String> visited = new LinkedHashSet<>();
        if (!nodes.contains(start)) {
            return visited;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            for (String neighbour : next.apply(queue.poll())) {
                if (nodes.contains(neighbour) && visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }

    private static List<String> distinct(List<Edge> edges, Function<Edge, String> key) {
        Set<String> ids = new LinkedHashSet<>();
        for (Edge edge : edges) {
            ids.add(key.apply(edge));
        }
        return List.copyOf(ids);
    }
}
