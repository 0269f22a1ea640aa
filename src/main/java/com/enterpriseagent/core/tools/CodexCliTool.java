package com.enterpriseagent.core.tools;

import com.enterpriseagent.core.error.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shells out to the Codex CLI for code generation tasks.
 */
@Component
public class CodexCliTool {

    private static final Logger log = LoggerFactory.getLogger(CodexCliTool.class);

    private final SandboxedShell shell;
    private final ToolProperties properties;

    public CodexCliTool(SandboxedShell shell, ToolProperties properties) {
        this.shell = shell;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.getCodex().isEnabled();
    }

    /**
     * Runs {@code codex --model <model> <taskType> <params...> --domain=<domain>}.
     *
     * @return scrubbed CLI output
     * @throws ToolUnavailableException when the CLI is not allowed, missing, or exits non-zero
     */
    public String invoke(String taskType, List<String> params, String domain) {
        var codex = properties.getCodex();
        List<String> command = new ArrayList<>();
        command.add(codex.getCommand());
        command.add("--model");
        command.add(codex.getModel());
        command.add(taskType);
        command.addAll(params);
        command.addAll(codex.getExtraArgs());
        command.add("--domain=" + (domain == null ? "" : domain));

        log.info("Invoking Codex CLI for {} ({} param(s))", taskType, params.size());
        ShellResult result = shell.run(command, properties.getAllowedPrograms(), properties.getShellTimeout());
        if (!result.succeeded()) {
            throw new ToolUnavailableException(ToolUnavailableException.EXECUTION_FAILED,
                    "Codex CLI exited with " + result.exitCode(),
                    Map.of("exit_code", result.exitCode(), "output", tail(result.output())));
        }
        return result.output().trim();
    }

    private static String tail(String output) {
        return output.length() <= 2000 ? output : output.substring(output.length() - 2000);
    }
}
