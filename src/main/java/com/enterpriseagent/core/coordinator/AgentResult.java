package com.enterpriseagent.core.coordinator;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one adapter invocation. Immutable once constructed.
 *
 * @param success      whether the adapter produced a usable result
 * @param output       output payload (for example {@code code}, {@code plan})
 * @param confidence   adapter confidence in the result, 0.0 to 1.0
 * @param costEstimate cost the adapter estimated before running
 * @param costActual   cost the adapter reports having consumed
 * @param validation   optional validation summary, empty when none
 * @param agent        name of the originating adapter
 * @param raw          unprocessed adapter payload, empty when none
 * @param error        error message for failed attempts, null otherwise
 */
public record AgentResult(
        boolean success,
        Map<String, Object> output,
        double confidence,
        double costEstimate,
        double costActual,
        Map<String, Object> validation,
        String agent,
        Map<String, Object> raw,
        String error
) implements Serializable {

    public AgentResult {
        output = frozen(output);
        validation = frozen(validation);
        raw = frozen(raw);
    }

    /**
     * Degraded result for an adapter attempt that raised instead of returning.
     */
    public static AgentResult failure(String agent, double costEstimate, String error) {
        return new AgentResult(false, Map.of(), 0.0, costEstimate, 0.0,
                Map.of(), agent, Map.of(), error);
    }

    /**
     * Result for an attempt abandoned at the adapter timeout. The estimate is
     * charged as the actual cost; the abandoned work may already have spent it.
     */
    public static AgentResult timedOut(String agent, double costEstimate, String error) {
        return new AgentResult(false, Map.of(), 0.0, costEstimate, costEstimate,
                Map.of(), agent, Map.of(), error);
    }

    /**
     * Compact view used in the coordinator trace and in error metadata.
     */
    public Map<String, Object> toTraceEntry() {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("agent", agent);
        entry.put("success", success);
        entry.put("confidence", confidence);
        entry.put("cost_estimate", costEstimate);
        entry.put("cost_actual", costActual);
        entry.put("error", error);
        return entry;
    }

    private static Map<String, Object> frozen(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>(toTraceEntry());
        map.put("output", output);
        map.put("validation", validation);
        return map;
    }
}
