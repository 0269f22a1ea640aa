package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.llm.LlmResponse;
import com.enterpriseagent.core.llm.ModelCatalog;
import com.enterpriseagent.core.llm.ResponseParser;
import com.enterpriseagent.core.model.ReflectionOutcome;
import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.state.RunState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReflectorTest {

    private static final Map<String, Object> FAILED = Map.of("passes", false, "reason", "coverage too low");

    private static Reflector reflector(RoleFixtures fx) {
        var mapper = new ObjectMapper();
        return new Reflector(fx.support, new ResponseParser(mapper), mapper);
    }

    private static void respond(RoleFixtures fx, String text) {
        when(fx.llmService.call(anyString(), anyString()))
                .thenReturn(new LlmResponse(text, ModelCatalog.OPENAI_GPT_5, 10, 10));
    }

    @Test
    void confidentProposalHalts() {
        var fx = RoleFixtures.online();
        respond(fx, "{\"analysis\": \"missing test\", \"revised_output\": \"fixed code\", \"confidence\": 0.85}");

        ReflectionOutcome outcome = reflector(fx).reflect(RoleFixtures.context(), FAILED, "code", "coding", 0, false);

        assertTrue(outcome.halt());
        assertEquals("fixed code", outcome.output());
        assertEquals(1, outcome.iterations());
        assertEquals("missing test", outcome.analysis());
    }

    @Test
    void lowConfidenceContinues() {
        var fx = RoleFixtures.online();
        respond(fx, "{\"analysis\": \"unsure\", \"revised_output\": \"\", \"confidence\": 0.4}");

        ReflectionOutcome outcome = reflector(fx).reflect(RoleFixtures.context(), FAILED, "code", "coding", 2, false);

        assertFalse(outcome.halt());
        assertEquals("code", outcome.output());
        assertEquals(3, outcome.iterations());
    }

    @Test
    void proseResponseBecomesRevisedOutput() {
        var fx = RoleFixtures.online();
        respond(fx, "Rewrite the loop to avoid the off-by-one.");

        ReflectionOutcome outcome = reflector(fx).reflect(RoleFixtures.context(), FAILED, "code", "coding", 0, false);

        assertEquals("Rewrite the loop to avoid the off-by-one.", outcome.output());
        assertEquals(0.0, outcome.confidence());
        assertFalse(outcome.halt());
    }

    @Test
    void ceilingHaltsWithoutCallingModel() {
        var fx = RoleFixtures.online();

        ReflectionOutcome outcome = reflector(fx).reflect(RoleFixtures.context(), FAILED, "code", "coding",
                RunState.MAX_ITERATIONS, false);

        assertTrue(outcome.halt());
        assertEquals(RunState.MAX_ITERATIONS, outcome.iterations());
        verify(fx.llmService, never()).call(anyString(), anyString());
    }

    @Test
    void offlineReflectionHalts() {
        var fx = RoleFixtures.offline();
        RunState state = RunState.of("t", "coding", false).merge(Map.of(
                "output", "code",
                "validation", new ValidationResult(false, "failing", 0.5, Map.of())));

        var update = reflector(fx).apply(RoleFixtures.context(), state);

        assertEquals(true, update.get("halted"));
        assertEquals(1, update.get("iterations"));
        assertEquals("code", update.get("output"));
    }
}
