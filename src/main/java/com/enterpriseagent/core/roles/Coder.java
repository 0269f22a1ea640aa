package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.error.ToolUnavailableException;
import com.enterpriseagent.core.llm.ModelCatalog;
import com.enterpriseagent.core.model.Generation;
import com.enterpriseagent.core.model.Plan;
import com.enterpriseagent.core.state.RunState;
import com.enterpriseagent.core.tools.CodexCliTool;
import com.enterpriseagent.core.tools.PiiScrubber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Produces the artifact from the plan, either through a model or the Codex CLI.
 */
@Component
public class Coder {

    private static final Logger log = LoggerFactory.getLogger(Coder.class);

    static final String ROLE = "Coder";

    private final RoleSupport support;
    private final CodexCliTool codexCliTool;

    public Coder(RoleSupport support, CodexCliTool codexCliTool) {
        this.support = support;
        this.codexCliTool = codexCliTool;
    }

    public Generation generate(RunContext context, String plan, String domain, boolean vulnFlag) {
        String planText = plan == null || plan.isBlank() ? "No plan available." : plan;
        String checklist = support.domainPack(domain).guidelinesAsBullets();
        if (checklist.isEmpty()) {
            checklist = "- Follow domain standards.";
        }
        String prompt = buildPrompt(planText, domain, checklist);

        String model = support.route(prompt, domain, vulnFlag);
        Generation generation;
        if (ModelCatalog.OPENAI_GPT_5_CODEX.equals(model)) {
            generation = generateWithCodex(context, prompt, domain, model);
        } else {
            String output = support.callModel(context, model, prompt, ROLE, "generate");
            generation = new Generation(output, model, Generation.SOURCE_MODEL);
        }
        support.remember(context, "coder_prompt", prompt);
        log.info("Generated {} chars via {} ({})", generation.output().length(),
                generation.source(), model.isBlank() ? "offline" : model);
        return generation;
    }

    private Generation generateWithCodex(RunContext context, String prompt, String domain, String model) {
        String output;
        try {
            output = codexCliTool.invoke("auto-edit", List.of("--prompt", prompt), domain);
        } catch (ToolUnavailableException e) {
            log.warn("Codex CLI unavailable [{}]: {}; falling back to {}", e.getCode(), e.getMessage(),
                    ModelCatalog.OPENAI_GPT_5);
            String fallback = support.callModel(context, ModelCatalog.OPENAI_GPT_5, prompt, ROLE, "generate");
            return new Generation(fallback, ModelCatalog.OPENAI_GPT_5, Generation.SOURCE_TOOL_FALLBACK);
        }
        context.costEstimator().trackEstimated(prompt.length() / 4, ROLE, "codex_cli", model);
        return new Generation(PiiScrubber.scrub(output), model, Generation.SOURCE_TOOL);
    }

    static String buildPrompt(String planText, String domain, String checklist) {
        return "Follow the structured plan below to produce the requested artefact.\n"
                + "Think step-by-step: 1) analyse each epic, 2) implement required changes, 3) self-validate "
                + "(lint/tests) and summarise results. Base strictly on provided repository context.\n"
                + "Domain: " + domain + "\nChecklist:\n" + checklist + "\nPlan:\n" + planText + "\n"
                + "Respond with the final artefact only after completing a brief self-check summary.";
    }

    public Map<String, Object> apply(RunContext context, RunState state) {
        String planText = state.plan().map(Plan::text).orElse("");
        Generation generation = generate(context, planText, state.domain(), state.vulnFlag());
        return Map.of(
                "output", generation.output(),
                "codeSource", generation.source(),
                "codeModel", generation.model());
    }
}
