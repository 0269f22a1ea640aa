package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.engine.AgentOrchestrator;
import com.enterpriseagent.core.engine.AgentOrchestratorFactory;
import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.error.NoSuccessfulResultException;
import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.metrics.AgentMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentCoordinatorTest {

    private static final double EPS = 1e-9;

    private CoordinatorProperties properties;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private List<AgentEvent> events;

    @BeforeEach
    void setUp() {
        properties = new CoordinatorProperties();
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    private AgentCoordinator coordinator(AgentAdapter primary, AgentAdapter secondary) {
        return new AgentCoordinator(properties, primary, secondary, eventBus, new AgentMetrics(registry));
    }

    @Nested
    @DisplayName("Execution modes")
    class Modes {

        @Test
        void singleModeNeverCallsSecondary() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.3, 0.10);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary).runTask("task", Map.of());

            assertEquals(ExecutionMode.SINGLE, outcome.mode());
            assertEquals("enterprise", outcome.result().agent());
            assertEquals(1, outcome.trace().size());
            assertTrue(secondary.requests.isEmpty());
            // the larger of estimate and actual is deducted
            assertEquals(0.28, outcome.budgetRemaining(), EPS);
            assertEquals(0.10, outcome.budgetConsumed(), EPS);
        }

        @Test
        void fallbackReplacesUnconfidentPrimary() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.3, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), null, "fallback", Map.of());

            assertEquals("lightweight", outcome.result().agent());
            assertTrue(outcome.fallbackUsed());
            assertEquals(2, outcome.trace().size());
            assertEquals(0.14, outcome.budgetConsumed(), EPS);
            assertEquals(0.26, outcome.budgetRemaining(), EPS);
            assertEquals(0.28, secondary.requests.get(0).budget(), EPS);
            assertEquals(1.0, registry.find("agent.dispatch.total")
                    .tag("mode", "fallback").tag("fallback_used", "true").counter().count());
        }

        @Test
        void fallbackSkippedForConfidentPrimary() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.85, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), null, "fallback", Map.of());

            assertEquals(1, outcome.trace().size());
            assertFalse(outcome.fallbackUsed());
        }

        @Test
        void ensembleTieGoesToCheaperResult() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.8, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.8, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), 0.5, "ensemble", Map.of());

            assertEquals("lightweight", outcome.result().agent());
            assertTrue(outcome.fallbackUsed());
        }

        @Test
        void ensembleKeepsBetterPrimary() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.95, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.6, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), 0.5, "ensemble", Map.of());

            assertEquals("enterprise", outcome.result().agent());
            assertTrue(outcome.fallbackUsed());
        }

        @Test
        void unknownModeIsRejected() {
            var adapter = StubAdapter.succeeding("enterprise", 0.12, 0.9, 0.12);
            var ex = assertThrows(AgentExecutionException.class,
                    () -> coordinator(adapter, adapter).runTask("task", Map.of(), null, "parallel", Map.of()));
            assertEquals("REQ-400", ex.getCode());
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        void nonPositiveBudgetIsRejected() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.9, 0.12);

            var ex = assertThrows(BudgetExceededException.class,
                    () -> coordinator(primary, primary).runTask("task", Map.of(), 0.0, null, Map.of()));

            assertEquals(BudgetExceededException.INVALID_BUDGET, ex.getCode());
            assertTrue(primary.requests.isEmpty());
        }

        @Test
        void primaryEstimateAboveBudgetIsRejectedBeforeRunning() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.9, 0.12);

            var ex = assertThrows(BudgetExceededException.class,
                    () -> coordinator(primary, primary).runTask("task", Map.of(), 0.05, null, Map.of()));

            assertEquals(BudgetExceededException.INSUFFICIENT_BUDGET, ex.getCode());
            assertEquals("enterprise", ex.getMetadata().get("adapter"));
            assertTrue(primary.requests.isEmpty());
        }

        @Test
        void requestedBudgetIsCappedAtMaximum() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.9, 0.12);

            CoordinatorOutcome outcome = coordinator(primary, primary).runTask("task", Map.of(), 5.0, null, Map.of());

            assertEquals(1.0, primary.requests.get(0).budget(), EPS);
            assertEquals(0.88, outcome.budgetRemaining(), EPS);
        }

        @Test
        void secondarySkippedBelowFallbackMinimum() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.3, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), 0.15, "fallback", Map.of());

            assertEquals(1, outcome.trace().size());
            assertEquals("enterprise", outcome.result().agent());
            assertTrue(secondary.requests.isEmpty());
        }

        @Test
        void secondarySkippedWhenEstimateExceedsRemaining() {
            properties.setFallbackMinBudget(0.01);
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.3, 0.12);
            var secondary = StubAdapter.succeeding("lightweight", 0.10, 0.9, 0.10);

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), 0.20, "fallback", Map.of());

            assertEquals(1, outcome.trace().size());
            assertTrue(secondary.requests.isEmpty());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void noSuccessCarriesFullTrace() {
            var primary = StubAdapter.unsuccessful("enterprise", 0.12, 0.4);
            var secondary = StubAdapter.unsuccessful("lightweight", 0.02, 0.2);

            var ex = assertThrows(NoSuccessfulResultException.class,
                    () -> coordinator(primary, secondary).runTask("task", Map.of(), null, "fallback", Map.of()));

            assertEquals(NoSuccessfulResultException.CODE, ex.getCode());
            assertEquals(2, ex.getTrace().size());
            assertEquals("enterprise", ex.getBestAttempt().agent());
            assertEquals("coordinator.completed", events.get(events.size() - 1).eventType());
        }

        @Test
        void primaryAgentErrorPropagatesWithItsCode() {
            var primary = StubAdapter.failing("enterprise", 0.12,
                    new AgentExecutionException("ENT-404", "Enterprise agent URL not configured", 501));
            var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

            var ex = assertThrows(AgentExecutionException.class,
                    () -> coordinator(primary, secondary).runTask("task", Map.of(), null, "fallback", Map.of()));

            assertEquals("ENT-404", ex.getCode());
            assertTrue(secondary.requests.isEmpty());
        }

        @Test
        void primaryUnexpectedErrorIsWrapped() {
            var primary = StubAdapter.failing("enterprise", 0.12, new IllegalStateException("socket closed"));

            var ex = assertThrows(AgentExecutionException.class,
                    () -> coordinator(primary, primary).runTask("task", Map.of()));

            assertEquals("AGENT-500", ex.getCode());
            assertEquals("socket closed", ex.getMetadata().get("detail"));
        }

        @Test
        void secondaryErrorBecomesFailedTraceEntry() {
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.5, 0.12);
            var secondary = StubAdapter.failing("lightweight", 0.02,
                    new AgentExecutionException("LITE-500", "Lightweight agent execution failed", 500));

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), null, "fallback", Map.of());

            assertEquals("enterprise", outcome.result().agent());
            AgentResult failed = outcome.trace().get(1);
            assertFalse(failed.success());
            assertEquals(0.0, failed.costActual());
            assertTrue(failed.error().startsWith("LITE-500"));
            assertEquals(0.28, outcome.budgetRemaining(), EPS);
            assertFalse(outcome.fallbackUsed());
        }

        @Test
        void slowAdapterTimesOut() {
            properties.setAdapterTimeout(Duration.ofMillis(50));
            var never = new CompletableFuture<AgentResult>();
            var primary = StubAdapter.hanging("enterprise", 0.12, never);

            var ex = assertThrows(AgentExecutionException.class,
                    () -> coordinator(primary, primary).runTask("task", Map.of()));

            assertEquals("AGENT-500", ex.getCode());
            assertTrue(never.isCancelled());
        }

        @Test
        void primaryTimeoutReportsChargedEstimate() {
            properties.setAdapterTimeout(Duration.ofMillis(50));
            var primary = StubAdapter.hanging("enterprise", 0.12, new CompletableFuture<>());

            var ex = assertThrows(AgentExecutionException.class,
                    () -> coordinator(primary, primary).runTask("task", Map.of()));

            assertEquals(0.12, ex.getMetadata().get("cost_charged"));
        }

        @Test
        void secondaryTimeoutIsChargedItsEstimate() {
            properties.setAdapterTimeout(Duration.ofMillis(50));
            var primary = StubAdapter.succeeding("enterprise", 0.12, 0.5, 0.12);
            var secondary = StubAdapter.hanging("lightweight", 0.02, new CompletableFuture<>());

            CoordinatorOutcome outcome = coordinator(primary, secondary)
                    .runTask("task", Map.of(), null, "fallback", Map.of());

            AgentResult abandoned = outcome.trace().get(1);
            assertFalse(abandoned.success());
            assertEquals(0.02, abandoned.costActual());
            assertEquals(0.14, outcome.budgetConsumed(), EPS);
            assertEquals(0.26, outcome.budgetRemaining(), EPS);
        }

        @Test
        void timedOutLocalPipelineIsInterrupted() throws Exception {
            properties.setAdapterTimeout(Duration.ofMillis(100));
            var interrupted = new CountDownLatch(1);
            var orchestrator = mock(AgentOrchestrator.class);
            doAnswer(invocation -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("cancelled");
                }
                return null;
            }).when(orchestrator).run(anyString(), anyString(), anyBoolean());
            var factory = mock(AgentOrchestratorFactory.class);
            when(factory.create(anyDouble())).thenReturn(orchestrator);
            var executor = Executors.newSingleThreadExecutor();
            try {
                var lightweight = new LightweightAgentAdapter(new CoordinatorProperties.Lightweight(), factory, executor);

                var ex = assertThrows(AgentExecutionException.class,
                        () -> coordinator(lightweight, lightweight).runTask("task", Map.of()));

                assertEquals("AGENT-500", ex.getCode());
                assertTrue(interrupted.await(2, TimeUnit.SECONDS), "worker was not interrupted");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void blankTaskIsRejected() {
            var adapter = StubAdapter.succeeding("enterprise", 0.12, 0.9, 0.12);
            var ex = assertThrows(AgentExecutionException.class, () -> coordinator(adapter, adapter).runTask("", Map.of()));
            assertEquals("REQ-400", ex.getCode());
        }
    }

    @Test
    void adapterCompletionsArePublished() {
        var primary = StubAdapter.succeeding("enterprise", 0.12, 0.3, 0.12);
        var secondary = StubAdapter.succeeding("lightweight", 0.02, 0.9, 0.02);

        coordinator(primary, secondary).runTask("task", Map.of(), null, "fallback", Map.of());

        var types = events.stream().map(AgentEvent::eventType).toList();
        assertEquals(List.of("coordinator.adapter.completed", "coordinator.adapter.completed", "coordinator.completed"),
                types);
        assertTrue(events.get(0).runId().startsWith("DSP-"));
        assertEquals(1.0, registry.find("agent.adapter.invocations")
                .tag("adapter", "lightweight").tag("success", "true").counter().count());
    }

    @Test
    void selectionPrefersConfidenceThenCost() {
        var cheap = new AgentResult(true, Map.of(), 0.7, 0.02, 0.02, Map.of(), "a", Map.of(), null);
        var pricey = new AgentResult(true, Map.of(), 0.7, 0.12, 0.12, Map.of(), "b", Map.of(), null);
        var best = new AgentResult(true, Map.of(), 0.9, 0.5, 0.5, Map.of(), "c", Map.of(), null);

        assertEquals("a", AgentCoordinator.select(List.of(pricey, cheap)).agent());
        assertEquals("c", AgentCoordinator.select(List.of(cheap, best, pricey)).agent());
    }
}
