package com.enterpriseagent.core.tools;

import com.enterpriseagent.core.error.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the configured test command in a workspace and parses pass/fail counts and coverage.
 */
@Component
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    /** coverage.py summary row: "TOTAL  120  3  98%" */
    private static final Pattern COVERAGE_PATTERN =
            Pattern.compile("TOTAL\\s+\\d+\\s+\\d+\\s+(\\d+)%");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    /** Maven/JUnit style: "Tests run: 10, Failures: 2" */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)");

    private final SandboxedShell shell;
    private final ToolProperties properties;

    public TestRunner(SandboxedShell shell, ToolProperties properties) {
        this.shell = shell;
        this.properties = properties;
    }

    /**
     * Runs the suite. A missing runner or a timeout is reported as a failed run
     * whose coverage equals {@code coverageThreshold}, so only the test result counts against it.
     */
    public TestRunResult run(Path workspace, double coverageThreshold) {
        var tests = properties.getTests();
        ShellResult result;
        try {
            result = shell.run(tests.getCommand(), properties.getAllowedPrograms(), tests.getTimeout(),
                    workspace, Map.of());
        } catch (ToolUnavailableException e) {
            String reason = ToolUnavailableException.NOT_INSTALLED.equals(e.getCode())
                    ? "test runner not available"
                    : "test run failed: " + e.getMessage();
            log.warn("Test suite did not run: {}", reason);
            return new TestRunResult(false, false, coverageThreshold, 0, 0, "", reason);
        }

        String output = result.output();
        int passed = firstInt(PYTEST_PASSED_PATTERN, output);
        int failed = firstInt(PYTEST_FAILED_PATTERN, output);
        Matcher maven = MAVEN_PATTERN.matcher(output);
        if (passed == 0 && failed == 0 && maven.find()) {
            int run = Integer.parseInt(maven.group(1));
            failed = Integer.parseInt(maven.group(2));
            passed = run - failed;
        }
        double coverage = parseCoverage(output, coverageThreshold);
        boolean ok = result.succeeded();
        log.info("Test suite exited {} ({} passed, {} failed, coverage {})",
                result.exitCode(), passed, failed, String.format("%.2f", coverage));
        return new TestRunResult(ok, true, coverage, passed, failed, tail(output, tests.getTailLines()),
                ok ? "" : "tests failed (exit " + result.exitCode() + ")");
    }

    /**
     * Last TOTAL row wins; output without a coverage report yields {@code fallback}.
     */
    static double parseCoverage(String output, double fallback) {
        Matcher matcher = COVERAGE_PATTERN.matcher(output == null ? "" : output);
        double coverage = fallback;
        while (matcher.find()) {
            coverage = Integer.parseInt(matcher.group(1)) / 100.0;
        }
        return coverage;
    }

    static String tail(String output, int lines) {
        if (output == null || output.isEmpty()) {
            return "";
        }
        List<String> all = Arrays.asList(output.split("\\R"));
        return String.join("\n", all.subList(Math.max(0, all.size() - lines), all.size()));
    }

    private static int firstInt(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }
}
