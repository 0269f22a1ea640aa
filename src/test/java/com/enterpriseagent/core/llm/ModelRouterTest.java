package com.enterpriseagent.core.llm;

import com.enterpriseagent.core.tools.ToolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelRouterTest {

    private LlmProperties llm;
    private ToolProperties tools;
    private ModelRouter router;

    @BeforeEach
    void setUp() {
        llm = new LlmProperties();
        tools = new ToolProperties();
        router = new ModelRouter(llm, tools);
    }

    @Test
    void noProviderMeansOffline() {
        assertEquals("", router.route("task", "coding", false));
    }

    @Test
    void vulnerabilityWorkGoesToOpus() {
        llm.setOpenaiApiKey("sk");
        llm.setAnthropicApiKey("ak");

        assertEquals(ModelCatalog.CLAUDE_OPUS_4, router.route("patch CVE", "coding", true));
    }

    @Test
    void vulnerabilityWithoutAnthropicFallsThrough() {
        llm.setOpenaiApiKey("sk");

        assertEquals(ModelCatalog.OPENAI_GPT_5, router.route("patch CVE", "coding", true));
    }

    @Test
    void smallJobsUseCodexWhenEnabled() {
        llm.setOpenaiApiKey("sk");
        tools.getCodex().setEnabled(true);

        assertEquals(ModelCatalog.OPENAI_GPT_5_CODEX, router.route("short task", "coding", false));
    }

    @Test
    void largeJobsSkipCodex() {
        llm.setOpenaiApiKey("sk");
        tools.getCodex().setEnabled(true);
        // 40k chars -> 10k tokens, well above the codex ceiling
        String big = "x".repeat(40_000);

        assertEquals(ModelCatalog.OPENAI_GPT_5, router.route(big, "coding", false));
    }

    @Test
    void providerPreferenceOrder() {
        llm.setGoogleApiKey("gk");
        assertEquals(ModelCatalog.GEMINI_2_5_PRO, router.route("t", "content", false));

        llm.setAnthropicApiKey("ak");
        assertEquals(ModelCatalog.CLAUDE_SONNET_4, router.route("t", "content", false));
    }

    @Test
    void availabilityFollowsProviderKeys() {
        llm.setAnthropicApiKey("ak");

        assertTrue(router.isAvailable(ModelCatalog.CLAUDE_OPUS_4));
        assertFalse(router.isAvailable(ModelCatalog.OPENAI_GPT_5));
        assertFalse(router.isAvailable("unknown"));
    }
}
