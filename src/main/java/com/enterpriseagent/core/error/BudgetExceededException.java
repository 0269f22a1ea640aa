package com.enterpriseagent.core.error;

import java.util.Map;

/**
 * Raised when requested or accumulated cost does not fit the available budget.
 */
public class BudgetExceededException extends AgentExecutionException {

    /** Requested budget is zero or negative. */
    public static final String INVALID_BUDGET = "COST-400";

    /** An adapter's estimate exceeds what is left of the budget. */
    public static final String INSUFFICIENT_BUDGET = "COST-401";

    /** A tracked cost pushed the running total over the budget. */
    public static final String BUDGET_EXCEEDED = "COST-402";

    public BudgetExceededException(String code, String message, Map<String, Object> metadata) {
        super(code, message, 402, metadata);
    }

    public static BudgetExceededException invalidBudget(double budget) {
        return new BudgetExceededException(INVALID_BUDGET,
                "Budget must be greater than zero",
                Map.of("budget", budget));
    }

    public static BudgetExceededException insufficient(String adapter, double estimate, double remaining) {
        return new BudgetExceededException(INSUFFICIENT_BUDGET,
                String.format("Insufficient budget for adapter %s: estimate %.4f exceeds remaining %.4f",
                        adapter, estimate, remaining),
                Map.of("adapter", adapter, "estimate", estimate, "remaining_budget", remaining));
    }

    public static BudgetExceededException exceeded(double total, double budget) {
        return new BudgetExceededException(BUDGET_EXCEEDED,
                String.format("Budget exceeded: total cost %.6f over budget %.4f", total, budget),
                Map.of("total_cost", total, "budget", budget));
    }
}
