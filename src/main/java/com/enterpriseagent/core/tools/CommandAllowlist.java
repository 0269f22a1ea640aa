package com.enterpriseagent.core.tools;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Matches a command's program name against allow-list patterns.
 * A pattern ending in {@code *} matches by prefix, anything else must match exactly.
 */
public final class CommandAllowlist {

    private CommandAllowlist() {
    }

    public static boolean isAllowed(String program, Collection<String> allowlist) {
        if (program == null || program.isBlank() || allowlist == null || allowlist.isEmpty()) {
            return false;
        }
        String name = programName(program);
        for (String pattern : allowlist) {
            if (pattern != null && matches(pattern.trim(), name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Bare executable name, so {@code /usr/local/bin/pytest} is checked as {@code pytest}.
     */
    static String programName(String program) {
        Path fileName = Path.of(program).getFileName();
        return fileName != null ? fileName.toString() : program;
    }

    private static boolean matches(String pattern, String name) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return name.startsWith(prefix);
        }
        return pattern.equals(name);
    }
}
