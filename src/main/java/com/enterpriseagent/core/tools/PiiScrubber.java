package com.enterpriseagent.core.tools;

import java.util.regex.Pattern;

/**
 * Removes e-mail-address-shaped strings from model and tool output.
 */
public final class PiiScrubber {

    public static final String REDACTED = "[REDACTED]";

    private static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private PiiScrubber() {
    }

    public static String scrub(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return EMAIL.matcher(text).replaceAll(REDACTED);
    }
}
