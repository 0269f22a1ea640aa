package com.enterpriseagent.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the agent CLI.
 * Status lines go to stderr so that stdout carries only the JSON result.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ENTERPRISE AGENT v0.1.0|@"));
        System.err.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENT]|@ " + message));
    }

    public static void success(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void json(String json) {
        System.out.println(json);
    }
}
