package com.enterpriseagent.core.governance;

import com.enterpriseagent.core.events.AgentEvent;
import com.enterpriseagent.core.events.EventBus;
import com.enterpriseagent.core.hitl.HitlGate;
import com.enterpriseagent.core.metrics.AgentMetrics;
import com.enterpriseagent.core.model.GovernanceAction;
import com.enterpriseagent.core.model.GovernanceDecision;
import com.enterpriseagent.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Circuit breaker that compares fresh quality metrics with thresholds.
 * <p>
 * Rules run in a fixed order (bug rate, complexity, maintainability) and the
 * first failing rule picks the remediation. Remediations are reported as
 * events and metrics only; carrying one out is left to the caller, and
 * destructive ones need {@link #hitlCheck(String, Map)} approval first.
 */
@Service
public class GovernanceChecker {

    private static final Logger log = LoggerFactory.getLogger(GovernanceChecker.class);

    private final MetricFetcher metricFetcher;
    private final GovernanceThresholds thresholds;
    private final HitlGate hitlGate;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    @Autowired
    public GovernanceChecker(MetricFetcher metricFetcher,
                             GovernanceProperties properties,
                             HitlGate hitlGate,
                             EventBus eventBus,
                             AgentMetrics metrics) {
        this(metricFetcher, properties.getThresholds().toThresholds(), hitlGate, eventBus, metrics);
    }

    public GovernanceChecker(MetricFetcher metricFetcher,
                             GovernanceThresholds thresholds,
                             HitlGate hitlGate,
                             EventBus eventBus,
                             AgentMetrics metrics) {
        this.metricFetcher = metricFetcher;
        this.thresholds = thresholds;
        this.hitlGate = hitlGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public GovernanceDecision evaluate(String runId, String domain, String component) {
        Map<String, Double> fetched = metricFetcher.fetch(domain, component);
        GovernanceDecision decision = decide(fetched);

        metrics.recordGovernanceResult(decision.passed());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("domain", domain);
        payload.put("passed", decision.passed());
        payload.put("metrics", decision.metrics());
        eventBus.publish(AgentEvent.of("governance.checked", runId, payload));

        decision.actionOpt().ifPresent(action -> trigger(runId, domain, action));
        return decision;
    }

    GovernanceDecision decide(Map<String, Double> fetched) {
        if (fetched.getOrDefault("bug_rate", 0.0) > thresholds.bugRate()) {
            return GovernanceDecision.fail(GovernanceAction.FIX_TARGETED, fetched);
        }
        if (fetched.getOrDefault("complexity", 0.0) > thresholds.complexity()) {
            return GovernanceDecision.fail(GovernanceAction.DELETE_REFACTOR_PARTS, fetched);
        }
        if (fetched.getOrDefault("maintainability", 100.0) < thresholds.maintainability()) {
            return GovernanceDecision.fail(GovernanceAction.REBUILD_FROM_SCRATCH, fetched);
        }
        return GovernanceDecision.pass(fetched);
    }

    public boolean check(RunState state) {
        return evaluate(state.runId(), state.domain(), null).passed();
    }

    /**
     * Asks the HITL gate whether an action at {@code riskLevel} may go ahead.
     */
    public boolean hitlCheck(String riskLevel, Map<String, Object> context) {
        Object action = context == null ? null : context.get("action");
        Object domain = context == null ? null : context.get("domain");
        String description = "governance action " + (action != null ? action : "review")
                + (domain != null ? " for " + domain : "");
        return hitlGate.approve(riskLevel, description);
    }

    private void trigger(String runId, String domain, GovernanceAction action) {
        log.info("Governance triggered action {} for domain {}{}", action.key(), domain,
                action.destructive() ? " (destructive, approval required)" : "");
        metrics.recordGovernanceAction(action.key());
        eventBus.publish(AgentEvent.of("governance.action", runId, Map.of(
                "action", action.key(),
                "domain", domain,
                "destructive", action.destructive())));
    }
}
