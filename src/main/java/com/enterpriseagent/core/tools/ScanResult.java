package com.enterpriseagent.core.tools;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vulnerability scan outcome.
 *
 * @param passes              true when no blocking vulnerability was found
 * @param issues              one entry per finding (id, title, severity)
 * @param exploitabilityScore mean severity weight scaled to [0, 1]
 */
public record ScanResult(
        boolean passes,
        List<Map<String, Object>> issues,
        double exploitabilityScore
) implements Serializable {

    public ScanResult {
        issues = List.copyOf(issues);
    }

    public static ScanResult clean() {
        return new ScanResult(true, List.of(), 0.0);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("passes", passes);
        map.put("issues", issues);
        map.put("exploitability_score", exploitabilityScore);
        return map;
    }
}
