package com.enterpriseagent.core.state;

import com.enterpriseagent.core.model.Domain;
import com.enterpriseagent.core.model.Plan;
import com.enterpriseagent.core.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State threaded through one pipeline run.
 * <p>
 * Backed by a plain key/value map with typed accessors for every field the
 * pipeline reads. Instances are never modified in place: nodes receive a
 * snapshot and return a partial update, which {@link #merge(Map)} folds into
 * a new snapshot once the node has fully returned. A {@code null} value in an
 * update removes the key.
 */
public final class RunState {

    /** Hard ceiling on reflection attempts within one run. */
    public static final int MAX_ITERATIONS = 5;

    private final Map<String, Object> data;

    public RunState(Map<String, Object> initData) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(initData));
    }

    public static RunState of(String task, String domain, boolean vulnFlag) {
        var init = new LinkedHashMap<String, Object>();
        init.put("task", task);
        init.put("domain", domain);
        init.put("vulnFlag", vulnFlag);
        init.put("iterations", 0);
        init.put("confidence", 0.0);
        return new RunState(init);
    }

    public RunState merge(Map<String, Object> update) {
        if (update == null || update.isEmpty()) {
            return this;
        }
        var next = new LinkedHashMap<>(data);
        update.forEach((key, value) -> {
            if (value == null) {
                next.remove(key);
            } else {
                next.put(key, value);
            }
        });
        return new RunState(next);
    }

    public Map<String, Object> data() {
        return data;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> value(String key) {
        return Optional.ofNullable((T) data.get(key));
    }

    // ── Input ────────────────────────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String task() {
        return this.<String>value("task").orElse("");
    }

    public String domain() {
        return this.<String>value("domain").orElse("");
    }

    public Optional<Domain> domainType() {
        return Domain.fromKey(domain());
    }

    public boolean vulnFlag() {
        return this.<Boolean>value("vulnFlag").orElse(false);
    }

    // ── Planning and generation ──────────────────────────────────────

    public Optional<Plan> plan() {
        return value("plan");
    }

    public String output() {
        return this.<String>value("output").orElse("");
    }

    public String codeSource() {
        return this.<String>value("codeSource").orElse("");
    }

    public String codeModel() {
        return this.<String>value("codeModel").orElse("");
    }

    // ── Validation and reflection ────────────────────────────────────

    public Optional<ValidationResult> validation() {
        return value("validation");
    }

    public boolean needsReflect() {
        return this.<Boolean>value("needsReflect").orElse(false);
    }

    public int iterations() {
        return this.<Integer>value("iterations").orElse(0);
    }

    public double confidence() {
        return this.<Double>value("confidence").orElse(0.0);
    }

    public boolean halted() {
        return this.<Boolean>value("halted").orElse(false);
    }

    public String reflectionAnalysis() {
        return this.<String>value("reflectionAnalysis").orElse("");
    }

    // ── Review ───────────────────────────────────────────────────────

    public List<Double> reviewScores() {
        return this.<List<Double>>value("reviewScores").orElse(List.of());
    }

    public List<String> reviewModels() {
        return this.<List<String>>value("reviewModels").orElse(List.of());
    }

    public List<String> reviewRationales() {
        return this.<List<String>>value("reviewRationales").orElse(List.of());
    }

    // ── Governance ───────────────────────────────────────────────────

    public boolean governancePassed() {
        return this.<Boolean>value("governancePassed").orElse(false);
    }

    public boolean governanceBlocked() {
        return this.<Boolean>value("governanceBlocked").orElse(false);
    }

    public Optional<String> governanceAction() {
        return value("governanceAction");
    }

    public Map<String, Double> governanceMetrics() {
        return this.<Map<String, Double>>value("governanceMetrics").orElse(Map.of());
    }

    // ── Execution bookkeeping ────────────────────────────────────────

    public Optional<String> error() {
        return value("error");
    }

    public Optional<String> errorCode() {
        return value("errorCode");
    }

    public List<String> visitedNodes() {
        return this.<List<String>>value("visitedNodes").orElse(List.of());
    }

    @Override
    public String toString() {
        return "RunState" + data;
    }
}
