package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.model.Domain;
import com.enterpriseagent.core.model.ValidationReport;
import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.state.RunState;
import com.enterpriseagent.core.tools.ToolProperties;
import com.enterpriseagent.core.validation.DomainValidators;
import com.enterpriseagent.core.validation.SecretsProvider;
import com.enterpriseagent.core.validation.ValidationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the domain check for the current artifact.
 */
@Component
public class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    static final String NO_VALIDATOR = "no validator registered for domain";

    private final RoleSupport support;
    private final DomainValidators validators;
    private final SecretsProvider secretsProvider;
    private final ToolProperties toolProperties;

    public Validator(RoleSupport support,
                     DomainValidators validators,
                     SecretsProvider secretsProvider,
                     ToolProperties toolProperties) {
        this.support = support;
        this.validators = validators;
        this.secretsProvider = secretsProvider;
        this.toolProperties = toolProperties;
    }

    public ValidationReport validate(String output, String domain) {
        Optional<Domain> known = Domain.fromKey(domain);
        ValidationResult result;
        if (known.isPresent()) {
            var request = new ValidationRequest(
                    output,
                    support.domainPack(domain).getCoverageThreshold(),
                    Path.of(toolProperties.getWorkspace()),
                    secretsProvider.secrets(),
                    toolProperties.getTests().isEnabled());
            result = validators.forDomain(known.get()).validate(request);
        } else {
            log.warn("No validator for domain '{}'; treating output as valid", domain);
            result = ValidationResult.pass(NO_VALIDATOR);
        }
        log.info("Validation {} for {}: {}", result.passes() ? "passed" : "failed", domain, result.reason());
        return ValidationReport.of(result, support.route(output, domain, false));
    }

    public Map<String, Object> apply(RunState state) {
        ValidationReport report = validate(state.output(), state.domain());
        return Map.of(
                "validation", report.raw(),
                "needsReflect", !report.raw().passes());
    }
}
