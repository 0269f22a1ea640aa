package com.enterpriseagent.core.validation;

import java.nio.file.Path;
import java.util.Map;

/**
 * Input handed to a domain check.
 *
 * @param output            artifact under validation
 * @param coverageThreshold minimum acceptable coverage-like score
 * @param workspace         directory tests and scans run in
 * @param secrets           credentials available to checks, keyed by name
 * @param runTests          false when tests must be skipped (e.g. nested inside another test run)
 */
public record ValidationRequest(
        String output,
        double coverageThreshold,
        Path workspace,
        Map<String, String> secrets,
        boolean runTests
) {

    public ValidationRequest {
        output = output == null ? "" : output;
        secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
    }

    public boolean hasSecret(String name) {
        String value = secrets.get(name);
        return value != null && !value.isBlank();
    }
}
