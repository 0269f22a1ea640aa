package com.enterpriseagent.core.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * SonarQube measures for coding work; fixed baselines for other domains.
 */
@Component
public class DefaultMetricFetcher implements MetricFetcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultMetricFetcher.class);

    static final Map<String, Double> CODING_BASELINE =
            Map.of("bug_rate", 0.2, "complexity", 15.0, "maintainability", 90.0);
    static final Map<String, Double> TRADING_BASELINE = Map.of("bug_rate", 0.1, "risk_score", 0.8);
    static final Map<String, Double> DEFAULT_BASELINE = Map.of("bug_rate", 0.0);

    private final SonarQubeClient sonarQube;

    public DefaultMetricFetcher(SonarQubeClient sonarQube) {
        this.sonarQube = sonarQube;
    }

    @Override
    public Map<String, Double> fetch(String domain, String component) {
        if ("coding".equals(domain)) {
            return sonarQube.fetchMetrics(component).orElseGet(() -> {
                log.debug("Using baseline coding metrics");
                return CODING_BASELINE;
            });
        }
        if ("trading".equals(domain)) {
            return TRADING_BASELINE;
        }
        return DEFAULT_BASELINE;
    }
}
