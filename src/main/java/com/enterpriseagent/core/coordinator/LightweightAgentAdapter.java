package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.engine.AgentOrchestrator;
import com.enterpriseagent.core.engine.AgentOrchestratorFactory;
import com.enterpriseagent.core.engine.RunReport;
import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the local role pipeline for the task, using the remaining dispatch budget as the run budget.
 */
public class LightweightAgentAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(LightweightAgentAdapter.class);

    public static final String NAME = "lightweight";

    private final CoordinatorProperties.Lightweight properties;
    private final AgentOrchestratorFactory orchestratorFactory;
    private final Executor executor;

    public LightweightAgentAdapter(CoordinatorProperties.Lightweight properties,
                                   AgentOrchestratorFactory orchestratorFactory,
                                   Executor executor) {
        this.properties = properties;
        this.orchestratorFactory = orchestratorFactory;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double estimateCost(AgentRequest request) {
        return properties.getCostEstimate();
    }

    @Override
    public CompletableFuture<AgentResult> execute(AgentRequest request) {
        return CancellableTask.supply(() -> invoke(request), executor);
    }

    AgentResult invoke(AgentRequest request) {
        String domain = request.contextString("domain", properties.getDomain());
        boolean vulnFlag = request.contextFlag("vuln");
        RunReport report;
        try {
            AgentOrchestrator orchestrator = orchestratorFactory.create(request.budget());
            report = orchestrator.run(domain, request.task(), vulnFlag);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Local pipeline abandoned after cancellation: {}", e.getMessage());
            } else {
                log.error("Local pipeline failed: {}", e.getMessage(), e);
            }
            throw new AgentExecutionException("LITE-500", "Lightweight agent execution failed", 500,
                    Map.of("detail", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), e);
        }
        return toResult(report);
    }

    AgentResult toResult(RunReport report) {
        boolean success = report.succeeded();
        var output = new LinkedHashMap<String, Object>();
        output.put("code", report.output());
        output.put("plan", report.plan().epics());
        output.put("run_id", report.runId());

        Map<String, Object> validation = report.state().validation()
                .map(ValidationResult::toMap)
                .orElse(Map.of());

        String error = null;
        if (!success) {
            error = report.error()
                    .orElse(report.governanceBlocked() ? "governance blocked the output" : "no output generated");
        }
        return new AgentResult(
                success,
                output,
                report.confidence(),
                properties.getCostEstimate(),
                report.costSummary().totalCost(),
                validation,
                NAME,
                report.toMap(),
                error);
    }
}
