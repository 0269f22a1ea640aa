package com.enterpriseagent.core.tools;

import com.enterpriseagent.core.error.ToolUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TestRunnerTest {

    private SandboxedShell shell;
    private TestRunner runner;

    @BeforeEach
    void setUp() {
        shell = mock(SandboxedShell.class);
        runner = new TestRunner(shell, new ToolProperties());
    }

    @Test
    void parsesPytestSummaryAndCoverage() {
        when(shell.run(anyList(), anyCollection(), any(), any(), anyMap())).thenReturn(new ShellResult(0, """
                Name      Stmts   Miss  Cover
                app.py      100      1    99%
                TOTAL       100      1    99%
                ===== 12 passed in 0.51s ====="""));

        TestRunResult result = runner.run(Path.of("."), 0.97);

        assertTrue(result.passed());
        assertTrue(result.executed());
        assertEquals(12, result.testsPassed());
        assertEquals(0.99, result.coverage(), 1e-9);
    }

    @Test
    void nonZeroExitFails() {
        when(shell.run(anyList(), anyCollection(), any(), any(), anyMap()))
                .thenReturn(new ShellResult(1, "3 passed, 2 failed"));

        TestRunResult result = runner.run(Path.of("."), 0.97);

        assertFalse(result.passed());
        assertEquals(2, result.testsFailed());
        assertTrue(result.reason().contains("exit 1"));
    }

    @Test
    void missingRunnerKeepsThresholdCoverage() {
        when(shell.run(anyList(), anyCollection(), any(), any(), anyMap()))
                .thenThrow(new ToolUnavailableException(ToolUnavailableException.NOT_INSTALLED, "missing", Map.of()));

        TestRunResult result = runner.run(Path.of("."), 0.97);

        assertFalse(result.passed());
        assertFalse(result.executed());
        assertEquals(0.97, result.coverage());
        assertEquals("test runner not available", result.reason());
    }

    @Test
    void mavenSummaryIsUnderstood() {
        when(shell.run(anyList(), anyCollection(), any(), any(), anyMap()))
                .thenReturn(new ShellResult(0, "Tests run: 10, Failures: 0, Errors: 0"));

        assertEquals(10, runner.run(Path.of("."), 0.5).testsPassed());
    }

    @Test
    void lastCoverageRowWins() {
        assertEquals(0.85, TestRunner.parseCoverage("TOTAL 10 5 50%\nTOTAL 20 3 85%", 0.0), 1e-9);
        assertEquals(0.4, TestRunner.parseCoverage("no report", 0.4), 1e-9);
    }
}
