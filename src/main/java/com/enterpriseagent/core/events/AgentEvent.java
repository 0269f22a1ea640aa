package com.enterpriseagent.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run or coordinator call executes.
 *
 * @param eventType event type (e.g. "run.started", "governance.action", "coordinator.completed")
 * @param runId     the run or dispatch this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String runId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AgentEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new AgentEvent(eventType, runId, payload, Instant.now());
    }
}
