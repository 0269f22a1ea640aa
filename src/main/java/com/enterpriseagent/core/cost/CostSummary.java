package com.enterpriseagent.core.cost;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of a run's spending.
 */
public record CostSummary(
        double totalCost,
        long totalTokens,
        double budget,
        List<CostEvent> events
) implements Serializable {

    public CostSummary {
        events = List.copyOf(events);
    }

    public int calls() {
        return events.size();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total_cost", totalCost);
        map.put("total_tokens", totalTokens);
        map.put("calls", calls());
        map.put("budget", budget);
        map.put("events", events.stream().map(CostEvent::toMap).toList());
        return map;
    }
}
