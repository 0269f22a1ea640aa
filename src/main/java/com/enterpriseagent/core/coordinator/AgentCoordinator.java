package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.error.NoSuccessfulResultException;
import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.logging.MdcContext;
import com.enterpriseagent.core.metrics.AgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cost-aware dispatch of a task across a primary and a secondary adapter.
 * <p>
 * The primary always runs first and its deduction completes before the
 * secondary is considered. Budget checks happen before an adapter is invoked.
 * Primary failures propagate; secondary failures become failed trace entries.
 * An attempt abandoned at the adapter timeout is cancelled with an interrupt
 * and charged its estimate.
 */
public class AgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);
    private static final AtomicInteger DISPATCH_COUNTER = new AtomicInteger(0);

    private final CoordinatorProperties properties;
    private final AgentAdapter primary;
    private final AgentAdapter secondary;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public AgentCoordinator(CoordinatorProperties properties,
                            AgentAdapter primary,
                            AgentAdapter secondary,
                            EventBus eventBus,
                            AgentMetrics metrics) {
        this.properties = properties;
        this.primary = primary;
        this.secondary = secondary;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public CoordinatorOutcome runTask(String task, Map<String, Object> context) {
        return runTask(task, context, null, null, Map.of());
    }

    /**
     * @param budget       requested budget, or null for the configured default
     * @param modeOverride execution mode, or null for the configured default
     * @throws AgentExecutionException {@code REQ-400} for a blank task or unknown mode
     * @throws BudgetExceededException  {@code COST-400} or {@code COST-401}
     * @throws NoSuccessfulResultException when no attempt succeeded
     */
    public CoordinatorOutcome runTask(String task,
                                      Map<String, Object> context,
                                      Double budget,
                                      String modeOverride,
                                      Map<String, Object> metadata) {
        if (task == null || task.isBlank()) {
            throw new AgentExecutionException("REQ-400", "Task prompt is required", 400);
        }
        ExecutionMode mode = ExecutionMode.fromString(
                modeOverride != null && !modeOverride.isBlank() ? modeOverride : properties.getMode());
        double requested = budget != null ? budget : properties.getDefaultBudget();
        double remaining = Math.min(properties.getMaxBudget(), requested);
        if (remaining <= 0) {
            metrics.incrementBudgetExceeded("coordinator");
            throw BudgetExceededException.invalidBudget(remaining);
        }

        String dispatchId = generateDispatchId();
        var request = new AgentRequest(task, context, remaining, mode, metadata);
        log.info("Dispatch {} started (mode={}, budget={})", dispatchId, mode.key(), remaining);

        List<AgentResult> trace = new ArrayList<>();
        double consumed = 0.0;

        Attempt first = attempt(dispatchId, primary, request, remaining, false);
        trace.add(first.result());
        consumed += first.result().costActual();
        remaining = first.remaining();

        if (shouldUseSecondary(mode, first.result())) {
            double secondaryEstimate = secondary.estimateCost(request);
            if (remaining < properties.getFallbackMinBudget()) {
                log.info("Secondary {} skipped: remaining budget {} below fallback minimum {}",
                        secondary.name(), remaining, properties.getFallbackMinBudget());
            } else if (secondaryEstimate > remaining) {
                log.info("Secondary {} skipped: estimate {} exceeds remaining budget {}",
                        secondary.name(), secondaryEstimate, remaining);
            } else {
                Attempt second = attempt(dispatchId, secondary, request, remaining, true);
                trace.add(second.result());
                consumed += second.result().costActual();
                remaining = second.remaining();
            }
        }

        List<AgentResult> successes = trace.stream().filter(AgentResult::success).toList();
        if (successes.isEmpty()) {
            AgentResult best = trace.stream().max(Comparator.comparingDouble(AgentResult::confidence)).orElseThrow();
            log.warn("Dispatch {} failed: no adapter succeeded ({} attempt(s))", dispatchId, trace.size());
            publishCompleted(dispatchId, mode, null, consumed, remaining, false);
            throw new NoSuccessfulResultException(trace, best);
        }
        AgentResult chosen = select(successes);
        boolean fallbackUsed = successes.stream().anyMatch(r -> !r.agent().equals(chosen.agent()));

        metrics.recordDispatch(mode.key(), fallbackUsed);
        publishCompleted(dispatchId, mode, chosen, consumed, remaining, fallbackUsed);
        log.info("Dispatch {} completed: {} chosen (confidence {}, consumed {}, remaining {})",
                dispatchId, chosen.agent(), chosen.confidence(), consumed, remaining);
        return new CoordinatorOutcome(chosen, trace, mode, consumed, remaining, fallbackUsed);
    }

    boolean shouldUseSecondary(ExecutionMode mode, AgentResult primaryResult) {
        return switch (mode) {
            case SINGLE -> false;
            case FALLBACK -> !primaryResult.success()
                    || primaryResult.confidence() < properties.getConfidenceThreshold();
            case ENSEMBLE -> true;
        };
    }

    /**
     * Highest confidence wins; ties go to the cheaper result.
     */
    static AgentResult select(List<AgentResult> successes) {
        return successes.stream()
                .max(Comparator.comparingDouble(AgentResult::confidence)
                        .thenComparing(Comparator.comparingDouble(AgentResult::costActual).reversed()))
                .orElseThrow();
    }

    private Attempt attempt(String dispatchId, AgentAdapter adapter, AgentRequest request,
                            double remaining, boolean skipOnError) {
        double estimate = adapter.estimateCost(request);
        if (estimate > remaining) {
            metrics.incrementBudgetExceeded("coordinator");
            throw BudgetExceededException.insufficient(adapter.name(), estimate, remaining);
        }

        MdcContext.setAdapter(dispatchId, adapter.name());
        long start = System.currentTimeMillis();
        try {
            AgentResult result;
            try {
                result = await(adapter, request.withBudget(remaining));
            } catch (AgentExecutionException e) {
                if (!skipOnError) {
                    throw e;
                }
                log.warn("Adapter {} failed [{}]: {}", adapter.name(), e.getCode(), e.getMessage());
                result = AgentResult.failure(adapter.name(), estimate, e.getCode() + ": " + e.getMessage());
                record(dispatchId, result, start);
                return new Attempt(result, remaining);
            } catch (AdapterTimeoutException e) {
                if (!skipOnError) {
                    throw new AgentExecutionException("AGENT-500",
                            "Agent " + adapter.name() + " execution error", 500,
                            Map.of("adapter", adapter.name(), "detail", describe(e), "cost_charged", estimate), e);
                }
                log.warn("Adapter {} abandoned: {}", adapter.name(), describe(e));
                result = AgentResult.timedOut(adapter.name(), estimate, describe(e));
                record(dispatchId, result, start);
                return new Attempt(result, Math.max(0.0, remaining - estimate));
            } catch (RuntimeException e) {
                if (!skipOnError) {
                    throw new AgentExecutionException("AGENT-500",
                            "Agent " + adapter.name() + " execution error", 500,
                            Map.of("adapter", adapter.name(), "detail", describe(e)), e);
                }
                log.warn("Adapter {} failed: {}", adapter.name(), describe(e));
                result = AgentResult.failure(adapter.name(), estimate, describe(e));
                record(dispatchId, result, start);
                return new Attempt(result, remaining);
            }

            double used = Math.max(result.costActual(), estimate);
            record(dispatchId, result, start);
            return new Attempt(result, Math.max(0.0, remaining - used));
        } finally {
            MdcContext.clear();
        }
    }

    private AgentResult await(AgentAdapter adapter, AgentRequest request) {
        Duration timeout = properties.getAdapterTimeout();
        CompletableFuture<AgentResult> future = adapter.execute(request);
        try {
            AgentResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new IllegalStateException("adapter returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterTimeoutException(adapter.name(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for " + adapter.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(describe(cause), cause);
        }
    }

    private void record(String dispatchId, AgentResult result, long start) {
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordAdapterInvocation(result.agent(), result.success(), elapsed);
        var payload = new LinkedHashMap<String, Object>(result.toTraceEntry());
        payload.put("durationMs", elapsed);
        eventBus.publish(AgentEvent.of("coordinator.adapter.completed", dispatchId, payload));
    }

    private void publishCompleted(String dispatchId, ExecutionMode mode, AgentResult chosen,
                                  double consumed, double remaining, boolean fallbackUsed) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("mode", mode.key());
        payload.put("chosen", chosen == null ? null : chosen.agent());
        payload.put("budgetConsumed", consumed);
        payload.put("budgetRemaining", remaining);
        payload.put("fallbackUsed", fallbackUsed);
        eventBus.publish(AgentEvent.of("coordinator.completed", dispatchId, payload));
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    static String generateDispatchId() {
        return String.format("DSP-%04d", DISPATCH_COUNTER.incrementAndGet());
    }

    private record Attempt(AgentResult result, double remaining) {
    }

    /**
     * An adapter did not answer within the configured timeout.
     */
    static final class AdapterTimeoutException extends RuntimeException {
        AdapterTimeoutException(String adapter, Duration timeout) {
            super("Agent " + adapter + " timed out after " + timeout.toSeconds() + "s");
        }
    }
}
