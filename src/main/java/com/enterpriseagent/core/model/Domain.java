package com.enterpriseagent.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of task domains the pipeline knows how to validate.
 */
public enum Domain {

    CODING("coding"),
    SOCIAL_MEDIA("social_media"),
    CONTENT("content"),
    TRADING("trading"),
    REAL_ESTATE("real_estate");

    private final String key;

    Domain(String key) {
        this.key = key;
    }

    /**
     * Configuration and wire key, e.g. {@code real_estate}.
     */
    public String key() {
        return key;
    }

    /**
     * Resolves a domain from its key; case-insensitive, hyphens treated as underscores.
     */
    public static Optional<Domain> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(d -> d.key.equals(normalized))
                .findFirst();
    }
}
