package com.enterpriseagent.core.coordinator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a coordinator dispatch.
 *
 * @param result          the winning adapter result
 * @param trace           every attempt in invocation order
 * @param mode            the resolved execution mode
 * @param budgetConsumed  sum of the actual cost of every traced attempt
 * @param budgetRemaining budget left after deductions
 * @param fallbackUsed    whether another adapter also succeeded
 */
public record CoordinatorOutcome(
        AgentResult result,
        List<AgentResult> trace,
        ExecutionMode mode,
        double budgetConsumed,
        double budgetRemaining,
        boolean fallbackUsed
) {
    public CoordinatorOutcome {
        trace = List.copyOf(trace);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("result", result.toMap());
        map.put("trace", trace.stream().map(AgentResult::toTraceEntry).toList());
        map.put("mode", mode.key());
        map.put("budget_consumed", budgetConsumed);
        map.put("budget_remaining", budgetRemaining);
        map.put("fallback_used", fallbackUsed);
        return map;
    }
}
