package com.enterpriseagent.core.tools;

/**
 * Completed sandboxed command. {@code output} holds merged stdout/stderr, already scrubbed.
 */
public record ShellResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
