package com.enterpriseagent.core.cost;

import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.llm.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Meters model and tool usage for one run and enforces its budget.
 * <p>
 * Every tracked call is appended as a {@link CostEvent}; the running total is
 * the sum of those events. The call that pushes the total over the budget is
 * still recorded before {@link BudgetExceededException} is thrown, and any
 * later call is rejected without being recorded.
 * <p>
 * Not thread-safe. Create one estimator per run.
 */
public class CostEstimator {

    private static final Logger log = LoggerFactory.getLogger(CostEstimator.class);

    public static final String DEFAULT_MODEL = ModelCatalog.OPENAI_GPT_5_CODEX;
    public static final double DEFAULT_BUDGET = 0.40;

    private static final double INPUT_SHARE = 0.25;

    private final double budget;
    private final List<CostEvent> events = new ArrayList<>();
    private double totalCost;
    private long totalTokens;
    private boolean exhausted;

    public CostEstimator() {
        this(DEFAULT_BUDGET);
    }

    public CostEstimator(double budget) {
        this.budget = budget;
    }

    public double track(long tokens, String role, String operation, String model, String direction) {
        return track(tokens, role, operation, model, TokenDirection.fromString(direction));
    }

    /**
     * Records the cost of {@code tokens} against {@code model}.
     *
     * @return the cost of this call
     * @throws BudgetExceededException once the cumulative total exceeds the budget
     */
    public double track(long tokens, String role, String operation, String model, TokenDirection direction) {
        if (exhausted) {
            throw BudgetExceededException.exceeded(totalCost, budget);
        }
        long count = Math.max(0, tokens);
        String resolvedModel = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        var pricing = ModelCatalog.pricing(resolvedModel);

        double cost = switch (direction) {
            case INPUT -> pricing.cost(count, 0);
            case OUTPUT -> pricing.cost(0, count);
            case TOTAL -> {
                long input = (long) (count * INPUT_SHARE);
                yield pricing.cost(input, count - input);
            }
        };

        events.add(new CostEvent(role, operation, resolvedModel, count, cost));
        totalCost += cost;
        totalTokens += count;
        log.debug("Tracked {} {} tokens for {}/{} on {}: {} (total {})",
                count, direction.name().toLowerCase(), role, operation, resolvedModel,
                String.format("%.6f", cost), String.format("%.6f", totalCost));

        if (totalCost > budget) {
            exhausted = true;
            log.warn("Budget exceeded by {}/{}: total {} > budget {}",
                    role, operation, String.format("%.6f", totalCost), budget);
            throw BudgetExceededException.exceeded(totalCost, budget);
        }
        return cost;
    }

    /**
     * Records non-model work (offline responses, prompt enhancements) as a combined token count.
     */
    public double trackEstimated(long tokens, String role, String operation, String model) {
        return track(tokens, role, operation, model, TokenDirection.TOTAL);
    }

    /**
     * Rough cost of handling text of the given length with the default model.
     */
    public double estimate(int complexity, String domain) {
        return estimateFor(complexity);
    }

    /**
     * Cost of {@code complexity / 4} tokens on the default model, split like a {@code total} call.
     */
    public static double estimateFor(int complexity) {
        long tokens = Math.max(0, complexity) / 4;
        long input = (long) (tokens * INPUT_SHARE);
        return ModelCatalog.pricing(DEFAULT_MODEL).cost(input, tokens - input);
    }

    public CostSummary summary() {
        double rounded = Math.round(totalCost * 1_000_000d) / 1_000_000d;
        return new CostSummary(rounded, totalTokens, budget, events);
    }

    public double totalCost() {
        return totalCost;
    }

    public double budget() {
        return budget;
    }

    public double remaining() {
        return Math.max(0.0, budget - totalCost);
    }
}
