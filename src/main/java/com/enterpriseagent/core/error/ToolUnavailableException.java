package com.enterpriseagent.core.error;

import java.util.Map;

/**
 * A required external tool or credential is missing, rejected or failed.
 */
public class ToolUnavailableException extends AgentExecutionException {

    public static final String NOT_ALLOWED = "TOOL-403";
    public static final String EXECUTION_FAILED = "TOOL-500";
    public static final String NOT_INSTALLED = "TOOL-503";

    public ToolUnavailableException(String code, String message, Map<String, Object> metadata) {
        super(code, message, statusFor(code), metadata);
    }

    public ToolUnavailableException(String code, String message, Map<String, Object> metadata, Throwable cause) {
        super(code, message, statusFor(code), metadata, cause);
    }

    private static int statusFor(String code) {
        return switch (code) {
            case NOT_ALLOWED -> 403;
            case NOT_INSTALLED -> 503;
            default -> 500;
        };
    }
}
