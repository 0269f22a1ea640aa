package com.enterpriseagent.core.engine;

import com.enterpriseagent.core.cost.CostSummary;
import com.enterpriseagent.core.model.Plan;
import com.enterpriseagent.core.state.RunState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Final result of one pipeline run.
 *
 * @param runId       the run identifier
 * @param state       the final workflow state
 * @param costSummary cost ledger at the end of the run
 */
public record RunReport(String runId, RunState state, CostSummary costSummary) {

    public Plan plan() {
        return state.plan().orElse(new Plan("", null, ""));
    }

    public String output() {
        return state.output();
    }

    public double confidence() {
        return state.confidence();
    }

    public boolean governanceBlocked() {
        return state.governanceBlocked();
    }

    public Optional<String> error() {
        return state.error();
    }

    public Optional<String> errorCode() {
        return state.errorCode();
    }

    /**
     * Whether the run produced releasable output: no error, non-blank output and not blocked.
     */
    public boolean succeeded() {
        return error().isEmpty() && !output().isBlank() && !governanceBlocked();
    }

    public Map<String, Object> toMap() {
        Plan plan = plan();
        var planMap = new LinkedHashMap<String, Object>();
        planMap.put("text", plan.text());
        planMap.put("epics", plan.epics());
        planMap.put("model", plan.model());

        var map = new LinkedHashMap<String, Object>();
        map.put("run_id", runId);
        map.put("plan", planMap);
        map.put("code", output());
        map.put("confidence", confidence());
        map.put("needs_reflect", state.needsReflect());
        map.put("governance_blocked", governanceBlocked());
        map.put("code_source", state.codeSource());
        map.put("cost_summary", costSummary.toMap());
        error().ifPresent(error -> map.put("error", error));
        errorCode().ifPresent(code -> map.put("error_code", code));
        return map;
    }
}
