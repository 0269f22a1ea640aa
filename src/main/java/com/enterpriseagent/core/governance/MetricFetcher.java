package com.enterpriseagent.core.governance;

import java.util.Map;

/**
 * Source of quality metrics for a governance check. Implementations degrade to
 * defaults rather than throwing.
 */
@FunctionalInterface
public interface MetricFetcher {

    Map<String, Double> fetch(String domain, String component);
}
