package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.error.AgentExecutionException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorModelTest {

    @Test
    void executionModeParsing() {
        assertEquals(ExecutionMode.SINGLE, ExecutionMode.fromString(null));
        assertEquals(ExecutionMode.SINGLE, ExecutionMode.fromString(" "));
        assertEquals(ExecutionMode.ENSEMBLE, ExecutionMode.fromString(" Ensemble "));
        var ex = assertThrows(AgentExecutionException.class, () -> ExecutionMode.fromString("race"));
        assertEquals("REQ-400", ex.getCode());
    }

    @Test
    void requestContextHelpers() {
        var context = new HashMap<String, Object>();
        context.put("domain", " ");
        context.put("vuln", Boolean.TRUE);
        context.put("strict", "TRUE");
        var request = new AgentRequest("t", context, 0.3, ExecutionMode.SINGLE, null);

        assertEquals("coding", request.contextString("domain", "coding"));
        assertTrue(request.contextFlag("vuln"));
        assertTrue(request.contextFlag("strict"));
        assertFalse(request.contextFlag("missing"));
        assertTrue(request.metadata().isEmpty());

        context.put("domain", "trading");
        assertEquals("coding", request.contextString("domain", "coding"));
        assertEquals(0.1, request.withBudget(0.1).budget());
    }

    @Test
    void failureResultHasNoCost() {
        AgentResult failed = AgentResult.failure("lightweight", 0.02, "LITE-500: boom");

        assertFalse(failed.success());
        assertEquals(0.0, failed.costActual());
        assertEquals(0.02, failed.costEstimate());
        assertEquals("LITE-500: boom", failed.toTraceEntry().get("error"));
    }

    @Test
    void outcomeMapUsesTraceEntries() {
        var winner = new AgentResult(true, Map.of("code", "x"), 0.9, 0.02, 0.01, null, "lightweight", null, null);
        var loser = AgentResult.failure("enterprise", 0.12, "ENT-503: down");
        var outcome = new CoordinatorOutcome(winner, List.of(loser, winner), ExecutionMode.FALLBACK, 0.01, 0.39, false);

        Map<String, Object> map = outcome.toMap();

        assertEquals("fallback", map.get("mode"));
        assertEquals(0.39, map.get("budget_remaining"));
        @SuppressWarnings("unchecked")
        var trace = (List<Map<String, Object>>) map.get("trace");
        assertEquals("enterprise", trace.get(0).get("agent"));
        assertFalse(trace.get(0).containsKey("output"));
        @SuppressWarnings("unchecked")
        var result = (Map<String, Object>) map.get("result");
        assertEquals(Map.of("code", "x"), result.get("output"));
    }
}
