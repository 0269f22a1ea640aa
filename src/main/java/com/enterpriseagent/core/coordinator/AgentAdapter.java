package com.enterpriseagent.core.coordinator;

import java.util.concurrent.CompletableFuture;

/**
 * One execution path the coordinator can dispatch a task to.
 * <p>
 * {@link #execute(AgentRequest)} may complete exceptionally; an
 * {@link com.enterpriseagent.core.error.AgentExecutionException} keeps its code,
 * anything else is reported as an adapter execution error.
 */
public interface AgentAdapter {

    String name();

    double estimateCost(AgentRequest request);

    CompletableFuture<AgentResult> execute(AgentRequest request);
}
