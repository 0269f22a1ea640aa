package com.enterpriseagent.core.cost;

import java.util.Locale;

/**
 * Which side of a model call a token count describes.
 */
public enum TokenDirection {

    INPUT,
    OUTPUT,
    /** Combined count, split 25% input and 75% output. */
    TOTAL;

    public static TokenDirection fromString(String raw) {
        if (raw == null) {
            return TOTAL;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "total" -> TOTAL;
            default -> throw new IllegalArgumentException("Unknown token direction: " + raw);
        };
    }
}
