package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;

/**
 * Domain-specific check run by the Validator role.
 */
@FunctionalInterface
public interface DomainValidator {

    ValidationResult validate(ValidationRequest request);
}
