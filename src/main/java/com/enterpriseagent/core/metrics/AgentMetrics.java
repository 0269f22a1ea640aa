package com.enterpriseagent.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs and coordinator dispatch.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String domain, String outcome) {
        Counter.builder("agent.runs.total")
                .tag("domain", domain)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(String domain, long ms) {
        Timer.builder("agent.run.duration")
                .tag("domain", domain)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunCost(double cost) {
        DistributionSummary.builder("agent.run.cost")
                .description("Total model and tool cost per run")
                .register(registry)
                .record(cost);
    }

    public void recordReflectionIterations(int iterations) {
        DistributionSummary.builder("agent.reflection.iterations")
                .register(registry)
                .record(iterations);
    }

    public void recordReviewConfidence(double confidence) {
        DistributionSummary.builder("agent.review.confidence")
                .register(registry)
                .record(confidence);
    }

    public void recordGovernanceResult(boolean passed) {
        Counter.builder("agent.governance.checks")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordGovernanceAction(String action) {
        Counter.builder("agent.governance.actions")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void incrementBudgetExceeded(String source) {
        Counter.builder("agent.budget.exceeded")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Records one adapter attempt made by the coordinator.
     *
     * @param adapter adapter name
     * @param success whether the attempt produced a successful result
     * @param ms      wall-clock duration of the attempt
     */
    public void recordAdapterInvocation(String adapter, boolean success, long ms) {
        Counter.builder("agent.adapter.invocations")
                .tag("adapter", adapter)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
        Timer.builder("agent.adapter.duration")
                .tag("adapter", adapter)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDispatch(String mode, boolean fallbackUsed) {
        Counter.builder("agent.dispatch.total")
                .tag("mode", mode)
                .tag("fallback_used", String.valueOf(fallbackUsed))
                .register(registry)
                .increment();
    }
}
