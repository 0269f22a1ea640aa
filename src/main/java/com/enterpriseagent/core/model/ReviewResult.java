package com.enterpriseagent.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Reviewer output: mean confidence plus one score, model and rationale per reviewer.
 */
public record ReviewResult(
        double confidence,
        List<Double> scores,
        List<String> models,
        List<String> rationales
) implements Serializable {

    public ReviewResult {
        scores = List.copyOf(scores);
        models = List.copyOf(models);
        rationales = List.copyOf(rationales);
    }
}
