package com.enterpriseagent.core.governance;

import com.enterpriseagent.core.http.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SonarQubeClientTest {

    private static SonarQubeClient client(GovernanceProperties.SonarQube props, HttpClient http) {
        return new SonarQubeClient(props, http, new ObjectMapper(), new RetryPolicy(2, Duration.ZERO, 1.0));
    }

    @Test
    void measuresAreTranslated() {
        var client = client(new GovernanceProperties.SonarQube(), mock(HttpClient.class));

        Map<String, Double> metrics = client.parseMeasures("""
                {"component": {"measures": [
                  {"metric": "bugs", "value": "4"},
                  {"metric": "complexity", "value": "20"},
                  {"metric": "maintainability_rating", "value": "2.0"}
                ]}}""").orElseThrow();

        assertEquals(0.2, metrics.get("bug_rate"), 1e-9);
        assertEquals(20.0, metrics.get("complexity"));
        assertEquals(2.0, metrics.get("maintainability"));
    }

    @Test
    void missingComplexityDoesNotDivideByZero() {
        var client = client(new GovernanceProperties.SonarQube(), mock(HttpClient.class));

        Map<String, Double> metrics = client.parseMeasures(
                "{\"component\": {\"measures\": [{\"metric\": \"bugs\", \"value\": \"3\"}]}}").orElseThrow();

        assertEquals(3.0, metrics.get("bug_rate"));
        assertEquals(1.0, metrics.get("maintainability"));
    }

    @Test
    void unconfiguredClientReturnsEmpty() {
        HttpClient http = mock(HttpClient.class);

        assertTrue(client(new GovernanceProperties.SonarQube(), http).fetchMetrics("svc").isEmpty());
        verifyNoInteractions(http);
    }

    @Test
    void unreachableServerDegradesToEmpty() throws Exception {
        var props = new GovernanceProperties.SonarQube();
        props.setUrl("http://sonar.local");
        props.setToken("t");
        HttpClient http = mock(HttpClient.class);
        when(http.send(any(), any())).thenThrow(new IOException("connection refused"));

        assertTrue(client(props, http).fetchMetrics("svc").isEmpty());
        verify(http, times(2)).send(any(), any());
    }

    @Test
    void fetcherFallsBackToBaselines() {
        var fetcher = new DefaultMetricFetcher(client(new GovernanceProperties.SonarQube(), mock(HttpClient.class)));

        assertEquals(DefaultMetricFetcher.CODING_BASELINE, fetcher.fetch("coding", null));
        assertEquals(DefaultMetricFetcher.TRADING_BASELINE, fetcher.fetch("trading", null));
        assertEquals(DefaultMetricFetcher.DEFAULT_BASELINE, fetcher.fetch("content", null));
    }
}
