package com.enterpriseagent.core.roles;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-domain packs tuning prompts, validation and review.
 * <p>
 * Bound from {@code agent.domains.packs.<domain>}; domains without a pack get
 * {@link Pack} defaults.
 */
@Component
@ConfigurationProperties(prefix = "agent.domains")
public class DomainProperties {

    private Map<String, Pack> packs = new HashMap<>();

    public Map<String, Pack> getPacks() {
        return packs;
    }

    public void setPacks(Map<String, Pack> packs) {
        this.packs = packs;
    }

    public Pack packFor(String domain) {
        String key = domain == null ? "" : domain.toLowerCase(Locale.ROOT).replace('-', '_');
        Pack pack = packs.get(key);
        return pack != null ? pack : new Pack();
    }

    public static class Pack {
        /** Domain focus phrase shown to the planner; defaults to the domain key. */
        private String promptAdapter = "";
        private List<String> generationGuidelines = new ArrayList<>();
        private double coverageThreshold = 0.97;
        private String reviewCriteria = "accuracy, safety, maintainability";

        public String getPromptAdapter() {
            return promptAdapter;
        }

        public void setPromptAdapter(String promptAdapter) {
            this.promptAdapter = promptAdapter;
        }

        public List<String> getGenerationGuidelines() {
            return generationGuidelines;
        }

        public void setGenerationGuidelines(List<String> generationGuidelines) {
            this.generationGuidelines = generationGuidelines;
        }

        public double getCoverageThreshold() {
            return coverageThreshold;
        }

        public void setCoverageThreshold(double coverageThreshold) {
            this.coverageThreshold = coverageThreshold;
        }

        public String getReviewCriteria() {
            return reviewCriteria;
        }

        public void setReviewCriteria(String reviewCriteria) {
            this.reviewCriteria = reviewCriteria;
        }

        public String promptAdapterOr(String domain) {
            return promptAdapter == null || promptAdapter.isBlank() ? domain : promptAdapter;
        }

        public String guidelinesAsBullets() {
            if (generationGuidelines == null || generationGuidelines.isEmpty()) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            for (String item : generationGuidelines) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("- ").append(item);
            }
            return sb.toString();
        }
    }
}
