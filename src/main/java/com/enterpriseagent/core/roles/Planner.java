package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.model.Plan;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Decomposes the task into ordered epics.
 */
@Component
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    static final String ROLE = "Planner";

    private final RoleSupport support;

    public Planner(RoleSupport support) {
        this.support = support;
    }

    public Plan decompose(RunContext context, String task, String domain) {
        DomainProperties.Pack pack = support.domainPack(domain);
        String guidelines = pack.guidelinesAsBullets();

        StringBuilder prompt = new StringBuilder()
                .append("Think step-by-step: Decompose the following task into actionable epics or steps.\n")
                .append("Base on provided data only; do not invent requirements.\n")
                .append("Domain focus: ").append(pack.promptAdapterOr(domain)).append(".\n")
                .append("Task: ").append(task).append('\n');
        if (!guidelines.isEmpty()) {
            prompt.append("Guidelines:\n").append(guidelines).append('\n');
        }

        String model = support.route(task, domain, false);
        String text = support.callModel(context, model, prompt.toString(), ROLE, "decompose");
        List<String> epics = Arrays.stream(text.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        support.remember(context, "plan", text);
        log.info("Plan ready: {} epic(s) from '{}'", epics.size(), model.isBlank() ? "offline" : model);
        return new Plan(text, epics, model);
    }

    public Map<String, Object> apply(RunContext context, RunState state) {
        return Map.of("plan", decompose(context, state.task(), state.domain()));
    }
}
