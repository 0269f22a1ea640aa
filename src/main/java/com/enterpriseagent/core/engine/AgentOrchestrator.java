package com.enterpriseagent.core.engine;

import com.enterpriseagent.core.cost.CostEstimator;
import com.enterpriseagent.core.cost.CostSummary;
import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.graph.AgentWorkflowGraph;
import com.enterpriseagent.core.logging.MdcContext;
import com.enterpriseagent.core.memory.MemoryStore;
import com.enterpriseagent.core.metrics.AgentMetrics;
import com.enterpriseagent.core.roles.RunContext;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the role pipeline for a single task.
 * <p>
 * Owns the run's {@link CostEstimator} and {@link MemoryStore}; build one per
 * run through {@link AgentOrchestratorFactory}. Not thread-safe.
 */
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final String runId;
    private final AgentWorkflowGraph workflowGraph;
    private final CostEstimator costEstimator;
    private final MemoryStore memory;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public AgentOrchestrator(String runId,
                             AgentWorkflowGraph workflowGraph,
                             CostEstimator costEstimator,
                             MemoryStore memory,
                             EventBus eventBus,
                             AgentMetrics metrics) {
        this.runId = runId;
        this.workflowGraph = workflowGraph;
        this.costEstimator = costEstimator;
        this.memory = memory;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the pipeline. Failures inside the pipeline, budget exhaustion
     * included, are reported in the returned state rather than thrown.
     *
     * @throws AgentExecutionException with code {@code REQ-400} when the task is blank
     */
    public RunReport run(String domain, String task, boolean vulnFlag) {
        if (task == null || task.isBlank()) {
            throw new AgentExecutionException("REQ-400", "Task must not be blank", 400);
        }
        String resolvedDomain = domain == null || domain.isBlank() ? "coding" : domain;
        long start = System.currentTimeMillis();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} (domain={}, vuln={}, budget={}), task: {}",
                    runId, resolvedDomain, vulnFlag, costEstimator.budget(), task);
            eventBus.publish(AgentEvent.of("run.started", runId, Map.of(
                    "domain", resolvedDomain, "task", task, "vulnFlag", vulnFlag)));

            int pruned = memory.prune();
            if (pruned > 0) {
                log.debug("Pruned {} expired memory record(s)", pruned);
            }

            RunState initial = RunState.of(task, resolvedDomain, vulnFlag).merge(Map.of("runId", runId));
            RunState result = workflowGraph.build(new RunContext(runId, costEstimator, memory)).invoke(initial);

            CostSummary summary = costEstimator.summary();
            RunReport report = new RunReport(runId, result, summary);
            record(report, resolvedDomain, System.currentTimeMillis() - start);
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private void record(RunReport report, String domain, long elapsed) {
        String outcome;
        if (report.error().isPresent()) {
            outcome = "failed";
        } else if (report.governanceBlocked()) {
            outcome = "blocked";
        } else {
            outcome = "completed";
        }
        if (report.errorCode().filter(BudgetExceededException.BUDGET_EXCEEDED::equals).isPresent()) {
            metrics.incrementBudgetExceeded("pipeline");
        }
        metrics.recordRunResult(domain, outcome);
        metrics.recordRunDuration(domain, elapsed);
        metrics.recordRunCost(report.costSummary().totalCost());
        metrics.recordReflectionIterations(report.state().iterations());
        metrics.recordReviewConfidence(report.confidence());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("outcome", outcome);
        payload.put("confidence", report.confidence());
        payload.put("totalCost", report.costSummary().totalCost());
        payload.put("visitedNodes", report.state().visitedNodes());
        report.error().ifPresent(error -> payload.put("error", error));
        eventBus.publish(AgentEvent.of("run.completed", runId, payload));

        if (report.error().isPresent()) {
            log.warn("Run {} {} after {} ms: {}", runId, outcome, elapsed, report.error().get());
        } else {
            log.info("Run {} {} in {} ms (confidence {}, cost ${})", runId, outcome, elapsed,
                    String.format("%.2f", report.confidence()),
                    String.format("%.6f", report.costSummary().totalCost()));
        }
    }

    public String runId() {
        return runId;
    }

    public CostEstimator costEstimator() {
        return costEstimator;
    }

    public MemoryStore memory() {
        return memory;
    }
}
