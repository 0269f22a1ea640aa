package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.error.AgentExecutionException;

import java.util.Locale;

/**
 * Policy for involving the secondary adapter.
 */
public enum ExecutionMode {
    /** Primary adapter only. */
    SINGLE,
    /** Secondary only when the primary fails or is not confident enough. */
    FALLBACK,
    /** Secondary always, budget permitting. */
    ENSEMBLE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws AgentExecutionException with code {@code REQ-400} for an unknown mode
     */
    public static ExecutionMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return SINGLE;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AgentExecutionException("REQ-400", "Unknown execution mode: " + value, 400);
        }
    }
}
