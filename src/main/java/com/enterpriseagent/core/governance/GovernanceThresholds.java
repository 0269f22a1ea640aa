package com.enterpriseagent.core.governance;

/**
 * Limits a governance check compares metrics against.
 *
 * @param bugRate         highest tolerated bugs per unit of complexity
 * @param complexity      highest tolerated cyclomatic complexity
 * @param maintainability lowest tolerated maintainability score
 */
public record GovernanceThresholds(double bugRate, double complexity, double maintainability) {

    public static GovernanceThresholds defaults() {
        return new GovernanceThresholds(1.0, 100, 0);
    }
}
