package com.enterpriseagent.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one governance check.
 *
 * @param passed  whether every metric was within its threshold
 * @param action  remediation triggered by the first failing rule, null when passed
 * @param metrics the metrics the decision was made on
 */
public record GovernanceDecision(
        boolean passed,
        GovernanceAction action,
        Map<String, Double> metrics
) implements Serializable {

    public GovernanceDecision {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static GovernanceDecision pass(Map<String, Double> metrics) {
        return new GovernanceDecision(true, null, metrics);
    }

    public static GovernanceDecision fail(GovernanceAction action, Map<String, Double> metrics) {
        return new GovernanceDecision(false, action, metrics);
    }

    public Optional<GovernanceAction> actionOpt() {
        return Optional.ofNullable(action);
    }
}
