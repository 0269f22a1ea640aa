package com.enterpriseagent.core.governance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agent.governance")
public class GovernanceProperties {

    private Thresholds thresholds = new Thresholds();
    private SonarQube sonarqube = new SonarQube();
    private Retry retry = new Retry();

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SonarQube getSonarqube() {
        return sonarqube;
    }

    public void setSonarqube(SonarQube sonarqube) {
        this.sonarqube = sonarqube;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public static class Thresholds {
        private double bugRate = 1.0;
        private double complexity = 100;
        private double maintainability = 0;

        public double getBugRate() {
            return bugRate;
        }

        public void setBugRate(double bugRate) {
            this.bugRate = bugRate;
        }

        public double getComplexity() {
            return complexity;
        }

        public void setComplexity(double complexity) {
            this.complexity = complexity;
        }

        public double getMaintainability() {
            return maintainability;
        }

        public void setMaintainability(double maintainability) {
            this.maintainability = maintainability;
        }

        public GovernanceThresholds toThresholds() {
            return new GovernanceThresholds(bugRate, complexity, maintainability);
        }
    }

    public static class SonarQube {
        private String url = "";
        private String token = "";
        /** Project key used when the run does not name one. */
        private String component = "default";
        private String metricKeys = "bugs,complexity,maintainability_rating";

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getComponent() {
            return component;
        }

        public void setComponent(String component) {
            this.component = component;
        }

        public String getMetricKeys() {
            return metricKeys;
        }

        public void setMetricKeys(String metricKeys) {
            this.metricKeys = metricKeys;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank() && token != null && !token.isBlank();
        }
    }

    public static class Retry {
        private int attempts = 3;
        private Duration backoff = Duration.ofMillis(1500);
        private double multiplier = 1.5;

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
