package com.enterpriseagent.core.graph;

import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, executable form of a {@link WorkflowGraph}.
 * <p>
 * {@link #invoke(RunState)} never throws for node or routing failures: the
 * failure is recorded in the state's {@code error} field and the walk stops,
 * so callers always get a well-formed state back. The names of executed nodes
 * are recorded in order under {@code visitedNodes}. An interrupt of the
 * calling thread stops the walk before the next node.
 */
public final class CompiledGraph {

    private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

    private final String startNode;
    private final Map<String, NodeAction> nodes;
    private final Map<String, String> edges;
    private final Map<String, EdgeRouter> routers;
    private final int recursionLimit;

    CompiledGraph(String startNode,
                  Map<String, NodeAction> nodes,
                  Map<String, String> edges,
                  Map<String, EdgeRouter> routers,
                  int recursionLimit) {
        this.startNode = startNode;
        this.nodes = Map.copyOf(nodes);
        this.edges = Map.copyOf(edges);
        this.routers = Map.copyOf(routers);
        this.recursionLimit = recursionLimit;
    }

    public RunState invoke(Map<String, Object> initialState) {
        return invoke(new RunState(initialState));
    }

    public RunState invoke(RunState initialState) {
        RunState state = initialState;
        List<String> visited = new ArrayList<>(state.visitedNodes());
        String current = startNode;
        int steps = 0;

        while (true) {
            if (steps++ >= recursionLimit) {
                log.error("Recursion limit {} reached at node '{}'", recursionLimit, current);
                return fail(state, visited, "graph", "recursion limit " + recursionLimit + " reached at " + current, null);
            }

            if (Thread.currentThread().isInterrupted()) {
                log.warn("Walk interrupted before node '{}'", current);
                return fail(state, visited, "graph", "interrupted before " + current, null);
            }

            NodeAction action = nodes.get(current);
            visited.add(current);
            Map<String, Object> update;
            try {
                update = action.apply(state);
            } catch (Exception e) {
                log.error("Node '{}' failed: {}", current, e.getMessage(), e);
                return fail(state, visited, current, e.getMessage(), e);
            }
            state = state.merge(withVisited(update, visited));

            String next;
            EdgeRouter router = routers.get(current);
            if (router != null) {
                try {
                    next = router.route(state);
                } catch (RuntimeException e) {
                    log.error("Router after '{}' failed: {}", current, e.getMessage(), e);
                    return fail(state, visited, current, "routing failed: " + e.getMessage(), e);
                }
            } else {
                next = edges.get(current);
            }

            if (WorkflowGraph.END.equals(next)) {
                log.debug("Graph reached END after {} step(s): {}", visited.size(), visited);
                return state;
            }
            if (next == null || !nodes.containsKey(next)) {
                String reason = next == null
                        ? "no outgoing edge from " + current
                        : "unknown next node '" + next + "' after " + current;
                log.error("Unresolved edge: {}", reason);
                return fail(state, visited, current, reason, null);
            }
            current = next;
        }
    }

    public String startNode() {
        return startNode;
    }

    private static Map<String, Object> withVisited(Map<String, Object> update, List<String> visited) {
        var merged = new HashMap<String, Object>();
        if (update != null) {
            merged.putAll(update);
        }
        merged.put("visitedNodes", List.copyOf(visited));
        return merged;
    }

    private static RunState fail(RunState state, List<String> visited, String node, String message, Exception cause) {
        var update = new LinkedHashMap<String, Object>();
        update.put("error", node + ": " + (message != null ? message : cause != null ? cause.getClass().getSimpleName() : "failed"));
        if (cause instanceof AgentExecutionException agentError) {
            update.put("errorCode", agentError.getCode());
        }
        update.put("visitedNodes", List.copyOf(visited));
        return state.merge(update);
    }
}
