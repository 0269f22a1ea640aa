package com.enterpriseagent.core.governance;

import com.enterpriseagent.core.model.GovernanceDecision;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Final pipeline step: runs the governance check and, when it fails, asks for
 * high-risk approval before the output may be released.
 */
@Component
public class GovernanceNode {

    private static final Logger log = LoggerFactory.getLogger(GovernanceNode.class);

    private final GovernanceChecker checker;

    public GovernanceNode(GovernanceChecker checker) {
        this.checker = checker;
    }

    public Map<String, Object> apply(RunState state) {
        GovernanceDecision decision = checker.evaluate(state.runId(), state.domain(), null);
        var update = new HashMap<String, Object>();
        update.put("governancePassed", decision.passed());
        update.put("governanceMetrics", decision.metrics());
        update.put("governanceBlocked", false);
        decision.actionOpt().ifPresent(action -> update.put("governanceAction", action.key()));

        if (!decision.passed()) {
            Map<String, Object> context = new HashMap<>();
            context.put("domain", state.domain());
            decision.actionOpt().ifPresent(action -> context.put("action", action.key()));
            boolean approved = checker.hitlCheck("high", context);
            if (!approved) {
                log.warn("Governance failed and release was not approved; output blocked");
                update.put("governanceBlocked", true);
            }
        }
        return update;
    }
}
