package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.error.BudgetExceededException;
import com.enterpriseagent.core.llm.ResponseParser;
import com.enterpriseagent.core.model.ReviewResult;
import com.enterpriseagent.core.model.ReviewScore;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores the final artifact with one or two independent models.
 */
@Component
public class Reviewer {

    private static final Logger log = LoggerFactory.getLogger(Reviewer.class);

    static final String ROLE = "Reviewer";
    static final double FALLBACK_SCORE = 0.5;

    private final RoleSupport support;
    private final ResponseParser parser;

    public Reviewer(RoleSupport support, ResponseParser parser) {
        this.support = support;
        this.parser = parser;
    }

    public ReviewResult review(RunContext context, String output, String domain, boolean vulnFlag) {
        List<String> models = new ArrayList<>();
        String primary = support.route(output, domain, vulnFlag);
        if (!primary.isBlank()) {
            models.add(primary);
        }
        String secondary = support.llmProperties().getSecondaryReviewer();
        if (secondary != null && !secondary.isBlank() && !models.contains(secondary)
                && support.router().isAvailable(secondary)) {
            models.add(secondary);
        }

        if (models.isEmpty()) {
            log.warn("No reviewer models available; confidence is 0");
            return new ReviewResult(0.0, List.of(0.0), List.of(), List.of("no reviewer models available"));
        }

        String criteria = support.domainPack(domain).getReviewCriteria();
        String prompt = "Score the following " + domain + " output.\n"
                + "Criteria: " + criteria + ". Think step-by-step, base only on supplied text, then return JSON "
                + "{\"score\": float between 0 and 1, \"rationale\": str}.\n\n"
                + output;

        List<Double> scores = new ArrayList<>();
        List<String> rationales = new ArrayList<>();
        for (String model : models) {
            double score;
            String rationale;
            try {
                String response = support.callModel(context, model, prompt, ROLE, "score");
                var parsed = parser.parseOrRaw(response, ReviewScore.class);
                if (parsed.isStructured() && parsed.value().score() != null) {
                    score = parsed.value().score();
                    rationale = parsed.value().rationale() == null ? "" : parsed.value().rationale().strip();
                } else {
                    score = Double.parseDouble(response.strip());
                    rationale = "";
                }
            } catch (BudgetExceededException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Reviewer {} fell back to default score: {}", model, e.getMessage());
                score = FALLBACK_SCORE;
                rationale = "fallback default";
            }
            scores.add(Math.max(0.0, Math.min(1.0, score)));
            rationales.add(rationale);
        }
        double confidence = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        log.info("Review confidence {} from {}", String.format("%.2f", confidence), models);
        return new ReviewResult(confidence, scores, models, rationales);
    }

    public Map<String, Object> apply(RunContext context, RunState state) {
        ReviewResult review = review(context, state.output(), state.domain(), state.vulnFlag());
        return Map.of(
                "confidence", review.confidence(),
                "reviewScores", review.scores(),
                "reviewModels", review.models(),
                "reviewRationales", review.rationales());
    }
}
