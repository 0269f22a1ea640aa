package com.enterpriseagent.dispatch.cli;

import com.enterpriseagent.core.coordinator.AgentCoordinator;
import com.enterpriseagent.core.coordinator.CoordinatorOutcome;
import com.enterpriseagent.core.error.AgentExecutionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agent dispatch "&lt;task&gt;"
 * <p>
 * Sends the task through the coordinator (enterprise service first, local
 * pipeline as secondary) and prints the outcome or the structured error.
 */
@Command(name = "dispatch", mixinStandardHelpOptions = true,
        description = "Dispatch a task across the enterprise and lightweight agents")
@Component
public class DispatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language task")
    private String task;

    @Option(names = {"--mode", "-m"}, description = "Execution mode: single, fallback, ensemble")
    private String mode;

    @Option(names = "--budget", description = "Dispatch budget in USD")
    private Double budget;

    @Option(names = {"--context", "-c"}, description = "Context entries, e.g. --context domain=coding")
    private Map<String, String> context = new LinkedHashMap<>();

    private final AgentCoordinator coordinator;
    private final ObjectMapper objectMapper;

    public DispatchCommand(AgentCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.info("Dispatching task...");
        try {
            CoordinatorOutcome outcome = coordinator.runTask(task, new LinkedHashMap<>(context), budget, mode, Map.of());
            ConsoleOutput.json(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(outcome.toMap()));
            ConsoleOutput.success(String.format("%s agent chosen (%s mode, consumed $%.4f)",
                    outcome.result().agent(), outcome.mode().key(), outcome.budgetConsumed()));
            return 0;
        } catch (AgentExecutionException e) {
            ConsoleOutput.error("[" + e.getCode() + "] " + e.getMessage());
            ConsoleOutput.json(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(e.toErrorResponse().toMap()));
            return 1;
        }
    }
}
