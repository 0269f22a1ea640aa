package com.enterpriseagent.core.graph;

import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphTest {

    private static RunState initial() {
        return RunState.of("task", "coding", false);
    }

    @Nested
    @DisplayName("Building")
    class Building {

        @Test
        void rejectsDuplicateNode() {
            var graph = new WorkflowGraph().addNode("a", s -> Map.of());
            assertThrows(IllegalArgumentException.class, () -> graph.addNode("a", s -> Map.of()));
        }

        @Test
        void rejectsReservedNames() {
            var graph = new WorkflowGraph();
            assertThrows(IllegalArgumentException.class, () -> graph.addNode(WorkflowGraph.END, s -> Map.of()));
            assertThrows(IllegalArgumentException.class, () -> graph.addNode(WorkflowGraph.START, s -> Map.of()));
        }

        @Test
        void rejectsEdgeToUnknownNodeAtCompile() {
            var graph = new WorkflowGraph()
                    .addNode("a", s -> Map.of())
                    .addEdge("a", "missing");
            assertThrows(IllegalStateException.class, graph::compile);
        }

        @Test
        void rejectsEmptyGraph() {
            assertThrows(IllegalStateException.class, () -> new WorkflowGraph().compile());
        }

        @Test
        void cannotModifyAfterCompile() {
            var graph = new WorkflowGraph().addNode("a", s -> Map.of()).addEdge("a", WorkflowGraph.END);
            graph.compile();
            assertThrows(IllegalStateException.class, () -> graph.addNode("b", s -> Map.of()));
        }

        @Test
        void startsAtFirstNodeWithoutExplicitStart() {
            var compiled = new WorkflowGraph()
                    .addNode("first", s -> Map.of())
                    .addNode("second", s -> Map.of())
                    .addEdge("first", "second")
                    .addEdge("second", WorkflowGraph.END)
                    .compile();
            assertEquals("first", compiled.startNode());
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        void mergesUpdatesInOrder() {
            var compiled = new WorkflowGraph()
                    .addNode("a", s -> Map.of("output", "from-a"))
                    .addNode("b", s -> Map.of("output", s.output() + "+b"))
                    .addEdge(WorkflowGraph.START, "a")
                    .addEdge("a", "b")
                    .addEdge("b", WorkflowGraph.END)
                    .compile();

            RunState result = compiled.invoke(initial());

            assertEquals("from-a+b", result.output());
            assertEquals(List.of("a", "b"), result.visitedNodes());
            assertTrue(result.error().isEmpty());
        }

        @Test
        void routerDecidesNextNode() {
            var compiled = new WorkflowGraph()
                    .addNode("check", s -> Map.of("iterations", s.iterations() + 1))
                    .addNode("done", s -> Map.of("halted", true))
                    .addConditionalEdges("check", s -> s.iterations() >= 3 ? "done" : "check")
                    .addEdge("done", WorkflowGraph.END)
                    .compile();

            RunState result = compiled.invoke(initial());

            assertEquals(3, result.iterations());
            assertTrue(result.halted());
            assertEquals(List.of("check", "check", "check", "done"), result.visitedNodes());
        }

        @Test
        void identicalInputsGiveIdenticalPaths() {
            var compiled = new WorkflowGraph()
                    .addNode("a", s -> Map.of("confidence", 0.5))
                    .addNode("b", s -> Map.of())
                    .addConditionalEdges("a", s -> s.confidence() > 0.4 ? "b" : WorkflowGraph.END)
                    .addEdge("b", WorkflowGraph.END)
                    .compile();

            assertEquals(compiled.invoke(initial()).visitedNodes(), compiled.invoke(initial()).visitedNodes());
        }

        @Test
        void nodeFailureIsCapturedInState() {
            var compiled = new WorkflowGraph()
                    .addNode("a", s -> Map.of("output", "partial"))
                    .addNode("b", s -> {
                        throw new IllegalStateException("boom");
                    })
                    .addEdge("a", "b")
                    .addEdge("b", WorkflowGraph.END)
                    .compile();

            RunState result = compiled.invoke(initial());

            assertEquals("b: boom", result.error().orElseThrow());
            assertEquals("partial", result.output());
            assertTrue(result.errorCode().isEmpty());
            assertEquals(List.of("a", "b"), result.visitedNodes());
        }

        @Test
        void agentErrorCodeIsPreserved() {
            var compiled = new WorkflowGraph()
                    .addNode("spend", s -> {
                        throw BudgetExceededException.exceeded(0.5, 0.4);
                    })
                    .addEdge("spend", WorkflowGraph.END)
                    .compile();

            RunState result = compiled.invoke(initial());

            assertEquals(BudgetExceededException.BUDGET_EXCEEDED, result.errorCode().orElseThrow());
        }

        @Test
        void recursionLimitStopsCycles() {
            var compiled = new WorkflowGraph()
                    .addNode("loop", s -> Map.of())
                    .addEdge("loop", "loop")
                    .recursionLimit(4)
                    .compile();

            RunState result = compiled.invoke(initial());

            assertTrue(result.error().orElseThrow().contains("recursion limit 4"));
            assertEquals(4, result.visitedNodes().size());
        }

        @Test
        void interruptStopsWalkBeforeNextNode() {
            var compiled = new WorkflowGraph()
                    .addNode("a", s -> {
                        Thread.currentThread().interrupt();
                        return Map.of("output", "partial");
                    })
                    .addNode("b", s -> Map.of("output", "full"))
                    .addEdge("a", "b")
                    .addEdge("b", WorkflowGraph.END)
                    .compile();

            try {
                RunState result = compiled.invoke(initial());

                assertEquals("graph: interrupted before b", result.error().orElseThrow());
                assertEquals("partial", result.output());
                assertEquals(List.of("a"), result.visitedNodes());
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        void unknownRouterTargetIsAnError() {
            var compiled = new WorkflowGraph()
                    .addNode("a", s -> Map.of())
                    .addConditionalEdges("a", s -> "nowhere")
                    .compile();

            RunState result = compiled.invoke(initial());

            assertTrue(result.error().orElseThrow().contains("unknown next node 'nowhere'"));
        }
    }
}
