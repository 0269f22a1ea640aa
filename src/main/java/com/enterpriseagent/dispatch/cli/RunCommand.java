package com.enterpriseagent.dispatch.cli;

import com.enterpriseagent.core.engine.AgentOrchestratorFactory;
import com.enterpriseagent.core.engine.RunReport;
import com.enterpriseagent.core.error.AgentExecutionException;
import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agent run "&lt;task&gt;"
 * <p>
 * Runs the role pipeline locally and prints the run result as JSON.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the local agent pipeline for a task")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language task")
    private String task;

    @Option(names = {"--domain", "-d"}, description = "Domain: coding, social_media, content, trading, real_estate",
            defaultValue = "coding")
    private String domain;

    @Option(names = "--vuln", description = "Treat the task as security sensitive")
    private boolean vuln;

    @Option(names = "--budget", description = "Run budget in USD (defaults to agent.cost.budget)")
    private Double budget;

    private final AgentOrchestratorFactory orchestratorFactory;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(AgentOrchestratorFactory orchestratorFactory, EventBus eventBus, ObjectMapper objectMapper) {
        this.orchestratorFactory = orchestratorFactory;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.info("Running " + domain + " pipeline...");
        RunReport report;
        try {
            var orchestrator = budget != null ? orchestratorFactory.create(budget) : orchestratorFactory.create();
            try (var governance = eventBus.subscribe(orchestrator.runId(), "governance.action",
                    RunCommand::printGovernanceAction)) {
                report = orchestrator.run(domain, task, vuln);
            }
        } catch (AgentExecutionException e) {
            ConsoleOutput.error("[" + e.getCode() + "] " + e.getMessage());
            ConsoleOutput.json(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(e.toErrorResponse().toMap()));
            return 1;
        }

        ConsoleOutput.json(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report.toMap()));
        if (report.error().isPresent()) {
            ConsoleOutput.error("Run " + report.runId() + " failed: " + report.error().get());
            return 1;
        }
        if (report.governanceBlocked()) {
            ConsoleOutput.warn("Run " + report.runId() + " blocked by governance");
            return 2;
        }
        ConsoleOutput.success(String.format("Run %s completed (confidence %.2f, cost $%.6f)",
                report.runId(), report.confidence(), report.costSummary().totalCost()));
        return 0;
    }

    private static void printGovernanceAction(AgentEvent event) {
        Object action = event.payload().get("action");
        boolean destructive = Boolean.TRUE.equals(event.payload().get("destructive"));
        ConsoleOutput.warn("Governance action " + action + (destructive ? " (destructive)" : ""));
    }
}
