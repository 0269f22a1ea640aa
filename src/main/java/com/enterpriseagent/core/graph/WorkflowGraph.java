package com.enterpriseagent.core.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable builder for a {@link CompiledGraph}.
 * <p>
 * Nodes are registered by unique name; each node may have a static edge, a
 * conditional router, or both (the router wins at run time). Execution starts
 * at the node named by an edge from {@link #START}, or at the first node
 * registered when no such edge exists. {@link #END} terminates a run.
 */
public class WorkflowGraph {

    public static final String START = "__start__";
    public static final String END = "__end__";

    private final Map<String, NodeAction> nodes = new LinkedHashMap<>();
    private final Map<String, String> edges = new LinkedHashMap<>();
    private final Map<String, EdgeRouter> routers = new LinkedHashMap<>();
    private String explicitStart;
    private int recursionLimit = 100;
    private boolean compiled;

    public WorkflowGraph addNode(String name, NodeAction action) {
        ensureOpen();
        Objects.requireNonNull(action, "action");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        if (START.equals(name) || END.equals(name)) {
            throw new IllegalArgumentException("Node name is reserved: " + name);
        }
        if (nodes.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate node: " + name);
        }
        nodes.put(name, action);
        return this;
    }

    public WorkflowGraph addEdge(String from, String to) {
        ensureOpen();
        Objects.requireNonNull(to, "to");
        if (END.equals(from)) {
            throw new IllegalArgumentException("END cannot have outgoing edges");
        }
        if (START.equals(from)) {
            explicitStart = to;
            return this;
        }
        if (edges.containsKey(from)) {
            throw new IllegalArgumentException("Node already has a static edge: " + from);
        }
        edges.put(from, to);
        return this;
    }

    public WorkflowGraph addConditionalEdges(String from, EdgeRouter router) {
        ensureOpen();
        Objects.requireNonNull(router, "router");
        if (START.equals(from) || END.equals(from)) {
            throw new IllegalArgumentException("Conditional edges cannot start at " + from);
        }
        if (routers.containsKey(from)) {
            throw new IllegalArgumentException("Node already has a router: " + from);
        }
        routers.put(from, router);
        return this;
    }

    /**
     * Maximum number of node executions per invocation before the run is halted.
     */
    public WorkflowGraph recursionLimit(int limit) {
        ensureOpen();
        if (limit < 1) {
            throw new IllegalArgumentException("recursionLimit must be positive");
        }
        this.recursionLimit = limit;
        return this;
    }

    public CompiledGraph compile() {
        ensureOpen();
        if (nodes.isEmpty()) {
            throw new IllegalStateException("Cannot compile an empty graph");
        }
        String start = explicitStart != null ? explicitStart : nodes.keySet().iterator().next();
        if (!nodes.containsKey(start)) {
            throw new IllegalStateException("Start node is not registered: " + start);
        }
        for (var edge : edges.entrySet()) {
            if (!nodes.containsKey(edge.getKey())) {
                throw new IllegalStateException("Edge from unknown node: " + edge.getKey());
            }
            if (!END.equals(edge.getValue()) && !nodes.containsKey(edge.getValue())) {
                throw new IllegalStateException("Edge to unknown node: " + edge.getKey() + " -> " + edge.getValue());
            }
        }
        for (String from : routers.keySet()) {
            if (!nodes.containsKey(from)) {
                throw new IllegalStateException("Router on unknown node: " + from);
            }
        }
        compiled = true;
        return new CompiledGraph(start, nodes, edges, routers, recursionLimit);
    }

    private void ensureOpen() {
        if (compiled) {
            throw new IllegalStateException("Graph has already been compiled");
        }
    }
}
