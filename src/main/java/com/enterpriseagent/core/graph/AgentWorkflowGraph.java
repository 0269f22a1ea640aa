package com.enterpriseagent.core.graph;

import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.governance.GovernanceNode;
import com.enterpriseagent.core.logging.MdcContext;
import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.roles.Coder;
import com.enterpriseagent.core.roles.Planner;
import com.enterpriseagent.core.roles.Reflector;
import com.enterpriseagent.core.roles.Reviewer;
import com.enterpriseagent.core.roles.RunContext;
import com.enterpriseagent.core.roles.Validator;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Wires the role pipeline onto a {@link WorkflowGraph}.
 * <pre>
 *   START -> planner -> coder -> validator -> [routeAfterValidation]
 *            -> reviewer                      (validation passed)
 *            -> reflector -> [routeAfterReflection]
 *               -> validator                  (not halted, loop)
 *               -> reviewer                   (halted)
 *   reviewer -> governance -> END
 * </pre>
 * A graph is compiled per run because the nodes close over that run's {@link RunContext}.
 */
@Component
public class AgentWorkflowGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkflowGraph.class);

    public static final String PLANNER = "planner";
    public static final String CODER = "coder";
    public static final String VALIDATOR = "validator";
    public static final String REFLECTOR = "reflector";
    public static final String REVIEWER = "reviewer";
    public static final String GOVERNANCE = "governance";

    private final Planner planner;
    private final Coder coder;
    private final Validator validator;
    private final Reflector reflector;
    private final Reviewer reviewer;
    private final GovernanceNode governance;
    private final EventBus eventBus;

    public AgentWorkflowGraph(Planner planner,
                              Coder coder,
                              Validator validator,
                              Reflector reflector,
                              Reviewer reviewer,
                              GovernanceNode governance,
                              EventBus eventBus) {
        this.planner = planner;
        this.coder = coder;
        this.validator = validator;
        this.reflector = reflector;
        this.reviewer = reviewer;
        this.governance = governance;
        this.eventBus = eventBus;
    }

    public CompiledGraph build(RunContext context) {
        return new WorkflowGraph()
                .addNode(PLANNER, instrumented(context, PLANNER, state -> planner.apply(context, state)))
                .addNode(CODER, instrumented(context, CODER, state -> coder.apply(context, state)))
                .addNode(VALIDATOR, instrumented(context, VALIDATOR, validator::apply))
                .addNode(REFLECTOR, instrumented(context, REFLECTOR, state -> reflector.apply(context, state)))
                .addNode(REVIEWER, instrumented(context, REVIEWER, state -> reviewer.apply(context, state)))
                .addNode(GOVERNANCE, instrumented(context, GOVERNANCE, governance::apply))
                .addEdge(WorkflowGraph.START, PLANNER)
                .addEdge(PLANNER, CODER)
                .addEdge(CODER, VALIDATOR)
                .addConditionalEdges(VALIDATOR, this::routeAfterValidation)
                .addConditionalEdges(REFLECTOR, this::routeAfterReflection)
                .addEdge(REVIEWER, GOVERNANCE)
                .addEdge(GOVERNANCE, WorkflowGraph.END)
                .compile();
    }

    String routeAfterValidation(RunState state) {
        boolean passes = state.validation().map(ValidationResult::passes).orElse(false);
        return passes ? REVIEWER : REFLECTOR;
    }

    String routeAfterReflection(RunState state) {
        if (state.halted() || state.iterations() >= RunState.MAX_ITERATIONS) {
            return REVIEWER;
        }
        return VALIDATOR;
    }

    private NodeAction instrumented(RunContext context, String name, NodeAction action) {
        return state -> {
            MdcContext.setRole(context.runId(), name);
            try {
                Map<String, Object> update = action.apply(state);
                log.debug("Node {} updated {}", name, update == null ? List.of() : new TreeSet<>(update.keySet()));
                eventBus.publish(AgentEvent.of(name + ".completed", context.runId(),
                        Map.of("fields", update == null ? List.of() : List.copyOf(new TreeSet<>(update.keySet())))));
                return update;
            } finally {
                MdcContext.clearRole();
            }
        };
    }
}
