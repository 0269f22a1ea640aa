package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.cost.CostEstimator;
import com.enterpriseagent.core.llm.LlmProperties;
import com.enterpriseagent.core.llm.LlmService;
import com.enterpriseagent.core.llm.ModelRouter;
import com.enterpriseagent.core.memory.MemoryStore;
import com.enterpriseagent.core.tools.ToolProperties;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Shared wiring for role tests: real routing and accounting around a mocked {@link LlmService}.
 */
final class RoleFixtures {

    final LlmService llmService = mock(LlmService.class);
    final LlmProperties llmProperties = new LlmProperties();
    final ToolProperties toolProperties = new ToolProperties();
    final DomainProperties domainProperties = new DomainProperties();
    final RoleSupport support;

    private RoleFixtures(boolean online) {
        if (online) {
            llmProperties.setOpenaiApiKey("sk-test");
        }
        when(llmService.isAvailable()).thenReturn(online);
        support = new RoleSupport(llmService, new ModelRouter(llmProperties, toolProperties),
                llmProperties, domainProperties);
    }

    static RoleFixtures online() {
        return new RoleFixtures(true);
    }

    static RoleFixtures offline() {
        return new RoleFixtures(false);
    }

    static RunContext context() {
        return context(10.0);
    }

    static RunContext context(double budget) {
        return new RunContext("RUN-test", new CostEstimator(budget), new MemoryStore());
    }
}
