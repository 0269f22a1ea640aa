package com.enterpriseagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured fix proposal a model returns during reflection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReflectionProposal(
        @JsonProperty("analysis") String analysis,
        @JsonProperty("fixes") List<Fix> fixes,
        @JsonProperty("selected_fix") Integer selectedFix,
        @JsonProperty("revised_output") String revisedOutput,
        @JsonProperty("confidence") Double confidence
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fix(
            @JsonProperty("description") String description,
            @JsonProperty("risks") String risks
    ) {}
}
