package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.cost.TokenDirection;
import com.enterpriseagent.core.llm.LlmEmptyResponseException;
import com.enterpriseagent.core.llm.LlmProperties;
import com.enterpriseagent.core.llm.LlmResponse;
import com.enterpriseagent.core.llm.LlmService;
import com.enterpriseagent.core.llm.ModelCatalog;
import com.enterpriseagent.core.llm.ModelRouter;
import com.enterpriseagent.core.llm.OfflineResponses;
import com.enterpriseagent.core.memory.MemoryStore;
import com.enterpriseagent.core.tools.PiiScrubber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Helpers shared by the pipeline roles: routing, metered model calls, domain packs and memory.
 * <p>
 * Every model call is charged to the run's {@link com.enterpriseagent.core.cost.CostEstimator};
 * a budget overrun therefore surfaces from here as a
 * {@link com.enterpriseagent.core.error.BudgetExceededException}.
 */
@Component
public class RoleSupport {

    private static final Logger log = LoggerFactory.getLogger(RoleSupport.class);

    private final LlmService llmService;
    private final ModelRouter modelRouter;
    private final LlmProperties llmProperties;
    private final DomainProperties domainProperties;

    public RoleSupport(LlmService llmService,
                       ModelRouter modelRouter,
                       LlmProperties llmProperties,
                       DomainProperties domainProperties) {
        this.llmService = llmService;
        this.modelRouter = modelRouter;
        this.llmProperties = llmProperties;
        this.domainProperties = domainProperties;
    }

    public String route(String text, String domain, boolean vulnFlag) {
        return modelRouter.route(text, domain, vulnFlag);
    }

    public ModelRouter router() {
        return modelRouter;
    }

    public LlmProperties llmProperties() {
        return llmProperties;
    }

    public DomainProperties.Pack domainPack(String domain) {
        return domainProperties.packFor(domain);
    }

    /**
     * Calls {@code model} with {@code prompt} on behalf of {@code role}, charging the run for it.
     * A blank model, or no provider at all, yields the role's offline response.
     * An empty model response is logged and returned as {@code ""}.
     */
    public String callModel(RunContext context, String model, String prompt, String role, String operation) {
        String fullPrompt = applyEnhancement(context, prompt, role, operation);

        if (model == null || model.isBlank() || !llmService.isAvailable()) {
            String offline = OfflineResponses.forRole(role);
            context.costEstimator().trackEstimated(fullPrompt.length() / 4, role, operation, ModelCatalog.STUB_MODEL);
            log.debug("{}.{} answered offline", role, operation);
            return offline;
        }

        LlmResponse response;
        try {
            response = llmService.call(model, fullPrompt);
        } catch (LlmEmptyResponseException e) {
            log.warn("{}.{} got an empty response from {}", role, operation, model);
            context.costEstimator().track(fullPrompt.length() / 4, role, operation, model, TokenDirection.INPUT);
            return "";
        }
        context.costEstimator().track(response.promptTokens(), role, operation, model, TokenDirection.INPUT);
        context.costEstimator().track(response.completionTokens(), role, operation, model, TokenDirection.OUTPUT);
        return PiiScrubber.scrub(response.text());
    }

    public void remember(RunContext context, String key, Object value) {
        context.memory().store(MemoryStore.SESSION, key, value);
    }

    private String applyEnhancement(RunContext context, String prompt, String role, String operation) {
        String enhancement = llmProperties.getPromptEnhancements().get(role.toLowerCase(Locale.ROOT));
        if (enhancement == null || enhancement.isBlank()) {
            return prompt;
        }
        context.costEstimator().trackEstimated(enhancement.length() / 4, role, operation + ".enhancement",
                ModelCatalog.STUB_MODEL);
        return enhancement.strip() + "\n\n" + prompt;
    }
}
