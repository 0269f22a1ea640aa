package com.enterpriseagent.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Validator role output: the check result, its flattened view, and the routed model.
 */
public record ValidationReport(
        ValidationResult raw,
        Map<String, Object> parsed,
        String model
) implements Serializable {

    public static ValidationReport of(ValidationResult result, String model) {
        return new ValidationReport(result, result.toMap(), model);
    }
}
