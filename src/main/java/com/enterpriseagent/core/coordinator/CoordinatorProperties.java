package com.enterpriseagent.core.coordinator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agent.coordinator")
public class CoordinatorProperties {

    /** Default execution mode: single, fallback or ensemble. */
    private String mode = "single";
    private double defaultBudget = 0.40;
    private double maxBudget = 1.00;
    /** Minimum remaining budget for the secondary adapter to be tried. */
    private double fallbackMinBudget = 0.05;
    private double confidenceThreshold = 0.8;
    private Duration adapterTimeout = Duration.ofMinutes(10);
    private int poolSize = 4;
    private Enterprise enterprise = new Enterprise();
    private Lightweight lightweight = new Lightweight();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public double getDefaultBudget() {
        return defaultBudget;
    }

    public void setDefaultBudget(double defaultBudget) {
        this.defaultBudget = defaultBudget;
    }

    public double getMaxBudget() {
        return maxBudget;
    }

    public void setMaxBudget(double maxBudget) {
        this.maxBudget = maxBudget;
    }

    public double getFallbackMinBudget() {
        return fallbackMinBudget;
    }

    public void setFallbackMinBudget(double fallbackMinBudget) {
        this.fallbackMinBudget = fallbackMinBudget;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public Duration getAdapterTimeout() {
        return adapterTimeout;
    }

    public void setAdapterTimeout(Duration adapterTimeout) {
        this.adapterTimeout = adapterTimeout;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Enterprise getEnterprise() {
        return enterprise;
    }

    public void setEnterprise(Enterprise enterprise) {
        this.enterprise = enterprise;
    }

    public Lightweight getLightweight() {
        return lightweight;
    }

    public void setLightweight(Lightweight lightweight) {
        this.lightweight = lightweight;
    }

    public static class Enterprise {
        private String url = "";
        private String token = "";
        private double costEstimate = 0.12;
        private Duration requestTimeout = Duration.ofSeconds(30);

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

        public double getCostEstimate() {
            return costEstimate;
        }

        public void setCostEstimate(double costEstimate) {
            this.costEstimate = costEstimate;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Lightweight {
        private double costEstimate = 0.02;
        /** Domain used when the dispatch context does not name one. */
        private String domain = "coding";

        public double getCostEstimate() {
            return costEstimate;
        }

        public void setCostEstimate(double costEstimate) {
            this.costEstimate = costEstimate;
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }
    }
}
