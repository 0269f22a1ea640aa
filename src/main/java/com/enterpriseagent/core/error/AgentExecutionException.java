package com.enterpriseagent.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base failure raised by the orchestration engine.
 * <p>
 * Every failure carries a stable machine-readable {@code code} (e.g. {@code COST-401},
 * {@code AGENT-417}), an HTTP-like {@code status} and a metadata bag describing the
 * circumstances (budget figures, attempt trace, adapter name).
 */
public class AgentExecutionException extends RuntimeException {

    private final String code;
    private final int status;
    private final Map<String, Object> metadata;

    public AgentExecutionException(String code, String message, int status) {
        this(code, message, status, Map.of(), null);
    }

    public AgentExecutionException(String code, String message, int status, Map<String, Object> metadata) {
        this(code, message, status, metadata, null);
    }

    public AgentExecutionException(String code, String message, int status,
                                   Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public ErrorResponse toErrorResponse() {
        return new ErrorResponse(code, getMessage(), status, metadata);
    }
}
