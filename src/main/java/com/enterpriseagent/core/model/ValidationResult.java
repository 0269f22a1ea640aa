package com.enterpriseagent.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a domain check.
 *
 * @param passes  whether the output passed every condition of the check
 * @param reason  human-readable explanation; conditions that failed joined with "; "
 * @param score   coverage-like score in [0, 1] (test coverage for coding)
 * @param metrics check-specific measurements
 */
public record ValidationResult(
        boolean passes,
        String reason,
        double score,
        Map<String, Object> metrics
) implements Serializable {

    public ValidationResult {
        reason = reason == null ? "" : reason;
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static ValidationResult pass(String reason) {
        return new ValidationResult(true, reason, 1.0, Map.of());
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("passes", passes);
        map.put("reason", reason);
        map.put("score", score);
        map.putAll(metrics);
        return map;
    }
}
