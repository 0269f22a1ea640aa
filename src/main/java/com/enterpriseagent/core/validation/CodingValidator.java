package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.tools.ScanResult;
import com.enterpriseagent.core.tools.TestRunResult;
import com.enterpriseagent.core.tools.TestRunner;
import com.enterpriseagent.core.tools.VulnerabilityScanner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Passes only when tests passed (or were skipped), coverage meets the threshold
 * and the vulnerability scan found nothing blocking.
 */
@Component
public class CodingValidator implements DomainValidator {

    public static final String SCANNER_TOKEN = "SNYK_TOKEN";

    private final TestRunner testRunner;
    private final VulnerabilityScanner scanner;

    public CodingValidator(TestRunner testRunner, VulnerabilityScanner scanner) {
        this.testRunner = testRunner;
        this.scanner = scanner;
    }

    @Override
    public ValidationResult validate(ValidationRequest request) {
        double threshold = request.coverageThreshold();
        TestRunResult tests = request.runTests()
                ? testRunner.run(request.workspace(), threshold)
                : TestRunResult.skipped(threshold);

        ScanResult scan = request.hasSecret(SCANNER_TOKEN)
                ? scanner.scan(request.output(), request.workspace())
                : ScanResult.clean();

        boolean coverageOk = tests.coverage() >= threshold;
        boolean passes = tests.passed() && coverageOk && scan.passes();

        List<String> reasons = new ArrayList<>();
        if (!tests.executed() && tests.passed()) {
            reasons.add("tests skipped");
        } else if (tests.passed()) {
            reasons.add("tests passed");
        } else {
            reasons.add(tests.reason().isBlank() ? "test failures" : tests.reason());
        }
        reasons.add(String.format("coverage %.2f%% (%s %.2f%%)",
                tests.coverage() * 100, coverageOk ? ">=" : "<", threshold * 100));
        reasons.add(scan.passes() ? "no blocking vulnerabilities" : "vulnerabilities detected");

        var metrics = new LinkedHashMap<String, Object>();
        metrics.put("tests_passed", tests.passed());
        metrics.put("tests_executed", tests.executed());
        metrics.put("coverage", tests.coverage());
        metrics.put("coverage_threshold", threshold);
        metrics.put("test_tail", tests.tail());
        metrics.put("vulnerability_scan", scan.toMap());
        return new ValidationResult(passes, String.join("; ", reasons), tests.coverage(), metrics);
    }
}
