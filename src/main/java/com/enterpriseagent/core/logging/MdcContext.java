package com.enterpriseagent.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing engine-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setRole(String runId, String role) {
        MDC.put("runId", runId);
        MDC.put("role", role);
    }

    public static void clearRole() {
        MDC.remove("role");
    }

    public static void setAdapter(String dispatchId, String adapter) {
        MDC.put("runId", dispatchId);
        MDC.put("adapter", adapter);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("role");
        MDC.remove("adapter");
    }
}
