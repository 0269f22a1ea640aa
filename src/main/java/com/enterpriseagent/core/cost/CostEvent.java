package com.enterpriseagent.core.cost;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One metered model or tool invocation.
 */
public record CostEvent(
        String role,
        String operation,
        String model,
        long tokens,
        double cost
) implements Serializable {

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("role", role);
        map.put("operation", operation);
        map.put("model", model);
        map.put("tokens", tokens);
        map.put("cost", cost);
        return map;
    }
}
