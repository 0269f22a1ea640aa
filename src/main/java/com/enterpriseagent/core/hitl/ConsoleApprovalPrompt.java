package com.enterpriseagent.core.hitl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the operator on the terminal; "y" or "yes" approves, anything else denies.
 */
@Component
public class ConsoleApprovalPrompt implements ApprovalPrompt {

    private static final Logger log = LoggerFactory.getLogger(ConsoleApprovalPrompt.class);

    private final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    @Override
    public boolean confirm(String question) {
        System.err.print(question);
        System.err.flush();
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read approval answer", e);
        }
        if (line == null) {
            log.warn("No approver input available (stdin closed), treating as denial");
            return false;
        }
        String answer = line.trim().toLowerCase(Locale.ROOT);
        return "y".equals(answer) || "yes".equals(answer);
    }
}
