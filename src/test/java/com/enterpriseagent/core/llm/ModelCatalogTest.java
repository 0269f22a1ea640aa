package com.enterpriseagent.core.llm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    @Test
    void knownModelsHaveProviders() {
        assertEquals("openai", ModelCatalog.providerOf(ModelCatalog.OPENAI_GPT_5_CODEX));
        assertEquals("anthropic", ModelCatalog.providerOf(ModelCatalog.CLAUDE_SONNET_4));
        assertEquals("google", ModelCatalog.providerOf(ModelCatalog.GEMINI_2_5_PRO));
    }

    @Test
    void providerInferredFromUnlistedNames() {
        assertEquals("anthropic", ModelCatalog.providerOf("claude-haiku"));
        assertEquals("", ModelCatalog.providerOf(ModelCatalog.STUB_MODEL));
    }

    @Test
    void overridesWinOverCatalogAlias() {
        assertEquals("custom-id", ModelCatalog.resolveAlias(ModelCatalog.CLAUDE_OPUS_4,
                Map.of(ModelCatalog.CLAUDE_OPUS_4, "custom-id")));
        assertEquals("claude-3-opus-20240229", ModelCatalog.resolveAlias(ModelCatalog.CLAUDE_OPUS_4, Map.of()));
        assertEquals("raw-model", ModelCatalog.resolveAlias("raw-model", null));
    }

    @Test
    void unlistedModelGetsNominalPricing() {
        var info = ModelCatalog.pricing("stub");

        assertEquals(ModelCatalog.NOMINAL_RATE_PER_1M, info.inputPricePer1M());
        assertEquals(ModelCatalog.NOMINAL_RATE_PER_1M, info.outputPricePer1M());
    }
}
