package com.enterpriseagent.core.tools;

import com.enterpriseagent.core.error.ToolUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs {@code snyk test --json} in the workspace.
 * <p>
 * Missing credentials, a missing CLI or an unreadable report fail open (the scan
 * passes with no issues) unless {@code agent.tools.snyk.fail-open} is false, in
 * which case they fail closed with a single synthetic issue.
 */
@Component
public class SnykScanner implements VulnerabilityScanner {

    private static final Logger log = LoggerFactory.getLogger(SnykScanner.class);

    private static final Map<String, Integer> SEVERITY_WEIGHTS = Map.of(
            "critical", 4,
            "high", 3,
            "medium", 2,
            "low", 1);

    private final SandboxedShell shell;
    private final ToolProperties properties;
    private final ObjectMapper objectMapper;

    public SnykScanner(SandboxedShell shell, ToolProperties properties, ObjectMapper objectMapper) {
        this.shell = shell;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return properties.getSnyk().hasToken();
    }

    @Override
    public ScanResult scan(String payload, Path workspace) {
        var snyk = properties.getSnyk();
        if (!snyk.hasToken()) {
            return unavailable("no scanner token configured");
        }

        List<String> command = new ArrayList<>(List.of(snyk.getCommand(), "test", "--json"));
        if (snyk.getProjectId() != null && !snyk.getProjectId().isBlank()) {
            command.add("--project-id=" + snyk.getProjectId());
        }

        ShellResult result;
        try {
            result = shell.run(command, properties.getAllowedPrograms(), properties.getShellTimeout(),
                    workspace, Map.of("SNYK_TOKEN", snyk.getToken()));
        } catch (ToolUnavailableException e) {
            return unavailable(e.getMessage());
        }

        try {
            return parseReport(result.output());
        } catch (Exception e) {
            return unavailable("unreadable scanner report: " + e.getMessage());
        }
    }

    ScanResult parseReport(String json) throws Exception {
        JsonNode root = objectMapper.readTree(json);
        List<Map<String, Object>> issues = new ArrayList<>();
        JsonNode vulnerabilities = root.path("vulnerabilities");
        for (JsonNode vuln : vulnerabilities) {
            var issue = new LinkedHashMap<String, Object>();
            issue.put("id", vuln.path("id").asText(""));
            issue.put("title", vuln.path("title").asText(""));
            issue.put("severity", vuln.path("severity").asText("low").toLowerCase(Locale.ROOT));
            issues.add(issue);
        }
        return new ScanResult(issues.isEmpty(), issues, exploitability(issues));
    }

    static double exploitability(List<Map<String, Object>> issues) {
        if (issues.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (var issue : issues) {
            sum += SEVERITY_WEIGHTS.getOrDefault(String.valueOf(issue.get("severity")), 1);
        }
        double score = sum / issues.size() / 4.0;
        return Math.round(score * 1000.0) / 1000.0;
    }

    private ScanResult unavailable(String reason) {
        if (properties.getSnyk().isFailOpen()) {
            log.warn("Vulnerability scan skipped ({}); failing open", reason);
            return ScanResult.clean();
        }
        log.warn("Vulnerability scan unavailable ({}); failing closed", reason);
        return new ScanResult(false,
                List.of(Map.of("id", "scanner-unavailable", "title", reason, "severity", "high")),
                0.75);
    }
}
