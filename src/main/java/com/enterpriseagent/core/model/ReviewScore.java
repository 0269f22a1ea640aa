package com.enterpriseagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Score a reviewer model returns for an artifact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewScore(Double score, String rationale) {
}
