package com.enterpriseagent.core.llm;

import java.util.Locale;
import java.util.Map;

/**
 * Deterministic per-role answers used when no model provider is available.
 */
public final class OfflineResponses {

    private static final Map<String, String> BY_ROLE = Map.of(
            "planner", "1. Review task requirements\n2. Outline implementation steps\n3. Validate deliverables",
            "coder", "# Offline output generated from the plan.",
            "reflector", "{\"analysis\": \"offline\", \"fixes\": [], \"selected_fix\": 0,"
                    + " \"revised_output\": \"\", \"confidence\": 0.8}",
            "reviewer", "{\"score\": 0.9, \"rationale\": \"offline review\"}");

    private OfflineResponses() {
    }

    public static String forRole(String role) {
        return BY_ROLE.getOrDefault(role == null ? "" : role.toLowerCase(Locale.ROOT), "");
    }
}
