package com.enterpriseagent.core.governance;

import com.enterpriseagent.core.http.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads component measures from the SonarQube Web API.
 */
@Component
public class SonarQubeClient {

    private static final Logger log = LoggerFactory.getLogger(SonarQubeClient.class);

    private final GovernanceProperties.SonarQube properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    @Autowired
    public SonarQubeClient(GovernanceProperties properties, ObjectMapper objectMapper) {
        this(properties.getSonarqube(),
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper,
                new RetryPolicy(properties.getRetry().getAttempts(),
                        properties.getRetry().getBackoff(),
                        properties.getRetry().getMultiplier()));
    }

    SonarQubeClient(GovernanceProperties.SonarQube properties, HttpClient httpClient,
                    ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    public boolean isConfigured() {
        return properties.isConfigured();
    }

    /**
     * Returns {@code bug_rate}, {@code complexity} and {@code maintainability} for the
     * component, or empty when SonarQube is not configured or unreachable.
     */
    public Optional<Map<String, Double>> fetchMetrics(String component) {
        if (!isConfigured()) {
            return Optional.empty();
        }
        String target = component == null || component.isBlank() ? properties.getComponent() : component;
        return retryPolicy.execute("SonarQube measures " + target, () -> get(target))
                .flatMap(this::parseMeasures);
    }

    private String get(String component) throws IOException, InterruptedException {
        String url = trimSlash(properties.getUrl()) + "/api/measures/component"
                + "?component=" + URLEncoder.encode(component, StandardCharsets.UTF_8)
                + "&metricKeys=" + URLEncoder.encode(properties.getMetricKeys(), StandardCharsets.UTF_8);
        String auth = Base64.getEncoder()
                .encodeToString((properties.getToken() + ":").getBytes(StandardCharsets.UTF_8));
        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(10))
                .header("Authorization", "Basic " + auth)
                .header("Accept", "application/json")
                .GET()
                .build();
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new IOException("SonarQube request failed (HTTP %d)".formatted(response.statusCode()));
        }
        return response.body();
    }

    Optional<Map<String, Double>> parseMeasures(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("SonarQube response parse error: {}", e.getMessage());
            return Optional.empty();
        }
        Map<String, Double> measures = new HashMap<>();
        for (JsonNode measure : root.path("component").path("measures")) {
            measures.put(measure.path("metric").asText(), measure.path("value").asDouble(0.0));
        }
        double complexity = measures.getOrDefault("complexity", 0.0);
        var metrics = new LinkedHashMap<String, Double>();
        metrics.put("bug_rate", measures.getOrDefault("bugs", 0.0) / Math.max(measures.getOrDefault("complexity", 1.0), 1.0));
        metrics.put("complexity", complexity);
        metrics.put("maintainability", measures.getOrDefault("maintainability_rating", 1.0));
        return Optional.of(metrics);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
