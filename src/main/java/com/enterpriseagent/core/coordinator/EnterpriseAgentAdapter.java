package com.enterpriseagent.core.coordinator;

import com.enterpriseagent.core.error.AgentExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Delegates the task to the remote enterprise agent service over HTTP.
 * <p>
 * Request: {@code POST {task, context, budget, mode}} with an optional bearer
 * token. Response: {@code {success, confidence, cost_summary, validation,
 * output | code, error}}.
 */
public class EnterpriseAgentAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(EnterpriseAgentAdapter.class);

    public static final String NAME = "enterprise";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final CoordinatorProperties.Enterprise properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public EnterpriseAgentAdapter(CoordinatorProperties.Enterprise properties, ObjectMapper objectMapper,
                                  Executor executor) {
        this(properties, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, executor);
    }

    EnterpriseAgentAdapter(CoordinatorProperties.Enterprise properties, HttpClient httpClient,
                           ObjectMapper objectMapper, Executor executor) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double estimateCost(AgentRequest request) {
        return properties.getCostEstimate();
    }

    @Override
    public CompletableFuture<AgentResult> execute(AgentRequest request) {
        return CancellableTask.supply(() -> invoke(request), executor);
    }

    AgentResult invoke(AgentRequest request) {
        String url = properties.getUrl();
        if (url == null || url.isBlank()) {
            throw new AgentExecutionException("ENT-404", "Enterprise agent URL not configured", 501);
        }

        HttpResponse<String> response;
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(properties.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(request)));
            if (properties.getToken() != null && !properties.getToken().isBlank()) {
                builder.header("Authorization", "Bearer " + properties.getToken());
            }
            log.info("POST {} (budget {})", url, request.budget());
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("ENT-500", "Enterprise agent call interrupted", 500, Map.of(), e);
        } catch (IOException | IllegalArgumentException e) {
            throw new AgentExecutionException("ENT-500", "Enterprise agent unreachable", 500,
                    Map.of("detail", String.valueOf(e.getMessage())), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AgentExecutionException("ENT-" + status, "Enterprise agent returned HTTP " + status, status,
                    Map.of("body", truncate(response.body())));
        }
        return parseResponse(response.body());
    }

    String requestBody(AgentRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("task", request.task());
        body.set("context", objectMapper.valueToTree(request.context()));
        body.put("budget", request.budget());
        body.put("mode", request.mode() == null ? null : request.mode().key());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AgentExecutionException("ENT-500", "Could not serialise enterprise request", 500, Map.of(), e);
        }
    }

    AgentResult parseResponse(String body) {
        JsonNode data;
        try {
            data = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new AgentExecutionException("ENT-500", "Invalid response from enterprise agent", 500,
                    Map.of("body", truncate(body)), e);
        }
        if (data == null || !data.isObject()) {
            throw new AgentExecutionException("ENT-500", "Invalid response from enterprise agent", 500,
                    Map.of("body", truncate(body)));
        }

        JsonNode costSummary = data.path("cost_summary");
        double estimate = costSummary.path("estimate").asDouble(properties.getCostEstimate());
        double actual = costSummary.has("actual")
                ? costSummary.path("actual").asDouble(estimate)
                : costSummary.path("total_cost").asDouble(properties.getCostEstimate());

        Map<String, Object> output;
        if (data.path("output").isObject()) {
            output = objectMapper.convertValue(data.get("output"), MAP_TYPE);
        } else if (data.hasNonNull("code") && !data.get("code").asText().isEmpty()) {
            output = Map.of("code", data.get("code").asText());
        } else {
            output = Map.of();
        }
        Map<String, Object> validation = data.path("validation").isObject()
                ? objectMapper.convertValue(data.get("validation"), MAP_TYPE)
                : Map.of();
        String error = data.hasNonNull("error") ? data.get("error").asText() : null;

        return new AgentResult(
                data.path("success").asBoolean(true),
                output,
                data.path("confidence").asDouble(0.0),
                estimate,
                actual,
                validation,
                NAME,
                objectMapper.convertValue(data, MAP_TYPE),
                error);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
