package com.enterpriseagent.core.cost;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agent.cost")
public class CostProperties {

    /** Per-run budget used when the caller does not supply one. */
    private double budget = CostEstimator.DEFAULT_BUDGET;

    public double getBudget() {
        return budget;
    }

    public void setBudget(double budget) {
        this.budget = budget;
    }
}
