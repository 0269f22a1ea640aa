package com.enterpriseagent.core.tools;

import java.io.Serializable;

/**
 * Outcome of running the workspace test suite with coverage.
 *
 * @param passed   whether the suite passed (or was skipped)
 * @param executed whether the suite actually ran
 * @param coverage total line coverage in [0, 1]
 * @param tail     last lines of the runner output
 * @param reason   why the suite did not pass, empty when it did
 */
public record TestRunResult(
        boolean passed,
        boolean executed,
        double coverage,
        int testsPassed,
        int testsFailed,
        String tail,
        String reason
) implements Serializable {

    public static TestRunResult skipped(double coverage) {
        return new TestRunResult(true, false, coverage, 0, 0, "", "tests skipped");
    }
}
