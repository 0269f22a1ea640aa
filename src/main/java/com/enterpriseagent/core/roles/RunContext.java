package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.cost.CostEstimator;
import com.enterpriseagent.core.memory.MemoryStore;

import java.util.Objects;

/**
 * Per-run collaborators handed to every role call: the run id, its cost ledger and its memory.
 */
public record RunContext(String runId, CostEstimator costEstimator, MemoryStore memory) {

    public RunContext {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(costEstimator, "costEstimator");
        Objects.requireNonNull(memory, "memory");
    }
}
