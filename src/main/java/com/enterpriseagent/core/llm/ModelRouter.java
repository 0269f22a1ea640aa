package com.enterpriseagent.core.llm;

import com.enterpriseagent.core.cost.CostEstimator;
import com.enterpriseagent.core.tools.ToolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chooses a logical model for a piece of work from the providers that are available.
 * <p>
 * Security-sensitive work goes to the most capable Anthropic model; small OpenAI
 * jobs go to the Codex CLI when it is installed. An empty result means no
 * provider is available and the caller should answer offline.
 */
@Service
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    /** Largest estimated cost still routed to the Codex CLI. */
    static final double CODEX_COST_CEILING = 0.05;

    private final LlmProperties llmProperties;
    private final ToolProperties toolProperties;

    public ModelRouter(LlmProperties llmProperties, ToolProperties toolProperties) {
        this.llmProperties = llmProperties;
        this.toolProperties = toolProperties;
    }

    public String route(String text, String domain, boolean vulnFlag) {
        String model = select(text, vulnFlag);
        log.debug("Routed {} chars (domain={}, vuln={}) to '{}'",
                text == null ? 0 : text.length(), domain, vulnFlag, model);
        return model;
    }

    private String select(String text, boolean vulnFlag) {
        if (vulnFlag && llmProperties.hasAnthropicKey()) {
            return ModelCatalog.CLAUDE_OPUS_4;
        }
        if (llmProperties.hasOpenaiKey()) {
            double estimate = CostEstimator.estimateFor(text == null ? 0 : text.length());
            if (estimate <= CODEX_COST_CEILING && toolProperties.getCodex().isEnabled()) {
                return ModelCatalog.OPENAI_GPT_5_CODEX;
            }
            return ModelCatalog.OPENAI_GPT_5;
        }
        if (llmProperties.hasAnthropicKey()) {
            return ModelCatalog.CLAUDE_SONNET_4;
        }
        if (llmProperties.hasGoogleKey()) {
            return ModelCatalog.GEMINI_2_5_PRO;
        }
        return "";
    }

    /**
     * Whether the provider serving {@code model} has credentials configured.
     */
    public boolean isAvailable(String model) {
        return llmProperties.isProviderAvailable(ModelCatalog.providerOf(model));
    }
}
