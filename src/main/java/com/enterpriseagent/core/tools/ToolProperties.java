package com.enterpriseagent.core.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agent.tools")
public class ToolProperties {

    /** Programs the sandboxed shell may start; a trailing * matches by prefix. */
    private List<String> allowedPrograms = new ArrayList<>(List.of("codex", "pytest", "snyk"));

    private Duration shellTimeout = Duration.ofSeconds(300);

    /** Working directory handed to validators and tools. */
    private String workspace = ".";

    private Codex codex = new Codex();
    private Snyk snyk = new Snyk();
    private Tests tests = new Tests();

    public List<String> getAllowedPrograms() {
        return allowedPrograms;
    }

    public void setAllowedPrograms(List<String> allowedPrograms) {
        this.allowedPrograms = allowedPrograms;
    }

    public Duration getShellTimeout() {
        return shellTimeout;
    }

    public void setShellTimeout(Duration shellTimeout) {
        this.shellTimeout = shellTimeout;
    }

    public String getWorkspace() {
        return workspace;
    }

    public void setWorkspace(String workspace) {
        this.workspace = workspace;
    }

    public Codex getCodex() {
        return codex;
    }

    public void setCodex(Codex codex) {
        this.codex = codex;
    }

    public Snyk getSnyk() {
        return snyk;
    }

    public void setSnyk(Snyk snyk) {
        this.snyk = snyk;
    }

    public Tests getTests() {
        return tests;
    }

    public void setTests(Tests tests) {
        this.tests = tests;
    }

    public static class Codex {

        /** Whether the Codex CLI is installed and may be selected by the router. */
        private boolean enabled = false;
        private String command = "codex";
        private String model = "gpt-5-codex";
        /** Extra arguments appended to every invocation. */
        private List<String> extraArgs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getExtraArgs() {
            return extraArgs;
        }

        public void setExtraArgs(List<String> extraArgs) {
            this.extraArgs = extraArgs;
        }
    }

    public static class Snyk {

        private String token = "";
        private String projectId = "";
        private String command = "snyk";
        /** Treat a missing token, missing CLI or failed scan as passing. */
        private boolean failOpen = true;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }

    public static class Tests {

        /** When false the coding check treats tests as skipped, e.g. when already inside a test run. */
        private boolean enabled = true;
        private List<String> command = new ArrayList<>(List.of(
                "pytest", "--maxfail=1", "--disable-warnings", "--cov", "--cov-report=term-missing"));
        private Duration timeout = Duration.ofSeconds(900);
        private int tailLines = 40;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getTailLines() {
            return tailLines;
        }

        public void setTailLines(int tailLines) {
            this.tailLines = tailLines;
        }
    }
}
