package com.enterpriseagent.core.error;

import com.enterpriseagent.core.coordinator.AgentResult;

import java.util.List;
import java.util.Map;

/**
 * Every attempted adapter failed. Carries the full attempt trace and the
 * highest-confidence attempt so callers can see which adapter failed and why.
 */
public class NoSuccessfulResultException extends AgentExecutionException {

    public static final String CODE = "AGENT-417";

    private final transient List<AgentResult> trace;
    private final transient AgentResult bestAttempt;

    public NoSuccessfulResultException(List<AgentResult> trace, AgentResult bestAttempt) {
        super(CODE, "No agent produced a successful result", 417,
                Map.of("trace", trace.stream().map(AgentResult::toTraceEntry).toList()));
        this.trace = List.copyOf(trace);
        this.bestAttempt = bestAttempt;
    }

    public List<AgentResult> getTrace() {
        return trace;
    }

    public AgentResult getBestAttempt() {
        return bestAttempt;
    }
}
