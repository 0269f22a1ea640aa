package com.enterpriseagent.core.tools;

import com.enterpriseagent.core.error.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external programs under an explicit allow-list and a timeout.
 * <p>
 * Commands are passed as argument vectors, never through a shell. Output
 * (stdout and stderr merged) is scrubbed of e-mail addresses before it is
 * returned.
 */
@Component
public class SandboxedShell {

    private static final Logger log = LoggerFactory.getLogger(SandboxedShell.class);

    public ShellResult run(List<String> command, Collection<String> allowlist, Duration timeout) {
        return run(command, allowlist, timeout, null, Map.of());
    }

    /**
     * @throws ToolUnavailableException {@code TOOL-403} when the program is not allow-listed,
     *                                  {@code TOOL-503} when it cannot be started,
     *                                  {@code TOOL-500} on timeout or interruption
     */
    public ShellResult run(List<String> command, Collection<String> allowlist, Duration timeout,
                           Path workdir, Map<String, String> environment) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        String program = command.get(0);
        if (!CommandAllowlist.isAllowed(program, allowlist)) {
            log.warn("Rejected command '{}': not in allow-list {}", program, allowlist);
            throw new ToolUnavailableException(ToolUnavailableException.NOT_ALLOWED,
                    "Program not allowed: " + program, Map.of("program", program));
        }

        var builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workdir != null) {
            builder.directory(workdir.toFile());
        }
        if (environment != null && !environment.isEmpty()) {
            builder.environment().putAll(environment);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Program '{}' could not be started: {}", program, e.getMessage());
            throw new ToolUnavailableException(ToolUnavailableException.NOT_INSTALLED,
                    "Program not available: " + program, Map.of("program", program), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        long start = System.currentTimeMillis();
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Program '{}' timed out after {}s", program, timeout.toSeconds());
                throw new ToolUnavailableException(ToolUnavailableException.EXECUTION_FAILED,
                        "Program timed out: " + program,
                        Map.of("program", program, "timeout_seconds", timeout.toSeconds()));
            }
            String text = output.get(5, TimeUnit.SECONDS);
            log.info("Program '{}' exited with {} in {}ms", program, process.exitValue(),
                    System.currentTimeMillis() - start);
            return new ShellResult(process.exitValue(), PiiScrubber.scrub(text));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolUnavailableException(ToolUnavailableException.EXECUTION_FAILED,
                    "Interrupted while running " + program, Map.of("program", program), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ToolUnavailableException(ToolUnavailableException.EXECUTION_FAILED,
                    "Failed to collect output of " + program, Map.of("program", program), e);
        }
    }

    private static String read(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
