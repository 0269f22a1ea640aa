package com.enterpriseagent.core.coordinator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Adapter answering from a fixed function and recording every request it receives.
 */
final class StubAdapter implements AgentAdapter {

    private final String name;
    private final double estimate;
    private final Function<AgentRequest, CompletableFuture<AgentResult>> behaviour;
    final List<AgentRequest> requests = new ArrayList<>();

    private StubAdapter(String name, double estimate, Function<AgentRequest, CompletableFuture<AgentResult>> behaviour) {
        this.name = name;
        this.estimate = estimate;
        this.behaviour = behaviour;
    }

    static StubAdapter succeeding(String name, double estimate, double confidence, double actual) {
        return new StubAdapter(name, estimate, request -> CompletableFuture.completedFuture(
                new AgentResult(true, Map.of("code", name + " output"), confidence, estimate, actual,
                        Map.of(), name, Map.of(), null)));
    }

    static StubAdapter failing(String name, double estimate, RuntimeException error) {
        return new StubAdapter(name, estimate, request -> CompletableFuture.failedFuture(error));
    }

    static StubAdapter unsuccessful(String name, double estimate, double confidence) {
        return new StubAdapter(name, estimate, request -> CompletableFuture.completedFuture(
                new AgentResult(false, Map.of(), confidence, estimate, estimate, Map.of(), name, Map.of(), "no output")));
    }

    static StubAdapter hanging(String name, double estimate, CompletableFuture<AgentResult> never) {
        return new StubAdapter(name, estimate, request -> never);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double estimateCost(AgentRequest request) {
        return estimate;
    }

    @Override
    public CompletableFuture<AgentResult> execute(AgentRequest request) {
        requests.add(request);
        return behaviour.apply(request);
    }
}
