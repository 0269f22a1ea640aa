package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.llm.LlmResponse;
import com.enterpriseagent.core.llm.ModelCatalog;
import com.enterpriseagent.core.model.Plan;
import com.enterpriseagent.core.state.RunState;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PlannerTest {

    @Test
    void offlinePlanHasThreeEpics() {
        var fx = RoleFixtures.offline();
        var ctx = RoleFixtures.context();

        Plan plan = new Planner(fx.support).decompose(ctx, "Build a REST API", "coding");

        assertEquals(3, plan.epics().size());
        assertEquals("", plan.model());
        assertEquals(plan.text(), ctx.memory().retrieve("session", "plan"));
    }

    @Test
    void promptCarriesTaskAndGuidelines() {
        var fx = RoleFixtures.online();
        var pack = new DomainProperties.Pack();
        pack.setPromptAdapter("secure backend engineering");
        pack.setGenerationGuidelines(List.of("Use type hints"));
        fx.domainProperties.setPacks(Map.of("coding", pack));
        when(fx.llmService.call(anyString(), anyString()))
                .thenReturn(new LlmResponse("1. Design\n\n2. Build", ModelCatalog.OPENAI_GPT_5, 10, 10));

        Plan plan = new Planner(fx.support).decompose(RoleFixtures.context(), "Build a REST API", "coding");

        var prompt = ArgumentCaptor.forClass(String.class);
        verify(fx.llmService).call(eq(ModelCatalog.OPENAI_GPT_5), prompt.capture());
        assertTrue(prompt.getValue().contains("Task: Build a REST API"));
        assertTrue(prompt.getValue().contains("Domain focus: secure backend engineering."));
        assertTrue(prompt.getValue().contains("- Use type hints"));
        assertEquals(List.of("1. Design", "2. Build"), plan.epics());
        assertEquals(ModelCatalog.OPENAI_GPT_5, plan.model());
    }

    @Test
    void applyReturnsPlanUpdate() {
        var fx = RoleFixtures.offline();

        var update = new Planner(fx.support).apply(RoleFixtures.context(), RunState.of("t", "content", false));

        assertInstanceOf(Plan.class, update.get("plan"));
    }
}
