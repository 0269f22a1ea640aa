package com.enterpriseagent.core.error;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error object surfaced to callers of the engine.
 */
public record ErrorResponse(
        String code,
        String message,
        int status,
        Map<String, Object> metadata
) implements Serializable {

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        map.put("status", status);
        map.put("metadata", metadata);
        return map;
    }
}
