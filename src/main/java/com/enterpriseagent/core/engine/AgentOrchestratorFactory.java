package com.enterpriseagent.core.engine;

import com.enterpriseagent.core.cost.CostEstimator;
import com.enterpriseagent.core.cost.CostProperties;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.graph.AgentWorkflowGraph;
import com.enterpriseagent.core.memory.MemoryStore;
import com.enterpriseagent.core.memory.MemoryStoreFactory;
import com.enterpriseagent.core.metrics.AgentMetrics;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates an {@link AgentOrchestrator} with its own cost ledger and memory for each run.
 */
@Service
public class AgentOrchestratorFactory {

    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AgentWorkflowGraph workflowGraph;
    private final MemoryStoreFactory memoryStoreFactory;
    private final EventBus eventBus;
    private final AgentMetrics metrics;
    private final CostProperties costProperties;

    public AgentOrchestratorFactory(AgentWorkflowGraph workflowGraph,
                                    MemoryStoreFactory memoryStoreFactory,
                                    EventBus eventBus,
                                    AgentMetrics metrics,
                                    CostProperties costProperties) {
        this.workflowGraph = workflowGraph;
        this.memoryStoreFactory = memoryStoreFactory;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.costProperties = costProperties;
    }

    public AgentOrchestrator create() {
        return create(costProperties.getBudget());
    }

    public AgentOrchestrator create(double budget) {
        return create(budget, memoryStoreFactory.create());
    }

    /**
     * @param memory a store shared with the caller instead of a fresh one
     */
    public AgentOrchestrator create(double budget, MemoryStore memory) {
        return new AgentOrchestrator(generateRunId(), workflowGraph, new CostEstimator(budget),
                memory, eventBus, metrics);
    }

    /**
     * Generates a run ID in the format RUN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }
}
