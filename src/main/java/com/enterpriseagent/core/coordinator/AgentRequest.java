package com.enterpriseagent.core.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A task handed to an adapter.
 *
 * @param task     natural-language task
 * @param context  caller-supplied context (domain, flags, component, ...)
 * @param budget   budget remaining for this attempt
 * @param mode     execution mode of the surrounding dispatch
 * @param metadata caller metadata passed through untouched
 */
public record AgentRequest(
        String task,
        Map<String, Object> context,
        double budget,
        ExecutionMode mode,
        Map<String, Object> metadata
) {
    public AgentRequest {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public AgentRequest withBudget(double remaining) {
        return new AgentRequest(task, context, remaining, mode, metadata);
    }

    public String contextString(String key, String defaultValue) {
        Object value = context.get(key);
        return value == null || value.toString().isBlank() ? defaultValue : value.toString();
    }

    public boolean contextFlag(String key) {
        Object value = context.get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }
}
