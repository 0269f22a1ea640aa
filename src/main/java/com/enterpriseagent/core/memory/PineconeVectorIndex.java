package com.enterpriseagent.core.memory;

import com.enterpriseagent.core.http.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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

/**
 * {@link VectorIndex} backed by the Pinecone data-plane REST API.
 */
public class PineconeVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PineconeVectorIndex.class);

    private final MemoryProperties.Pinecone properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public PineconeVectorIndex(MemoryProperties.Pinecone properties, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this(properties, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, retryPolicy);
    }

    PineconeVectorIndex(MemoryProperties.Pinecone properties, HttpClient httpClient,
                        ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void upsert(String id, float[] values, Map<String, Object> metadata) {
        String body = upsertBody(id, values, metadata);
        var result = retryPolicy.execute("Pinecone upsert " + id, () -> post(body));
        if (result.isEmpty()) {
            log.warn("Vector mirror skipped for memory key {}", id);
        }
    }

    @Override
    public int dimension() {
        return properties.getDimension();
    }

    String upsertBody(String id, float[] values, Map<String, Object> metadata) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode vectors = body.putArray("vectors");
        ObjectNode vector = vectors.addObject();
        vector.put("id", id);
        ArrayNode array = vector.putArray("values");
        for (float v : values) {
            array.add(v);
        }
        vector.set("metadata", objectMapper.valueToTree(metadata));
        if (properties.getNamespace() != null && !properties.getNamespace().isBlank()) {
            body.put("namespace", properties.getNamespace());
        }
        return body.toString();
    }

    private Integer post(String body) throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(trimSlash(properties.getIndexHost()) + "/vectors/upsert"))
                .timeout(Duration.ofSeconds(10))
                .header("Api-Key", properties.getApiKey())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new IOException("Pinecone upsert failed (HTTP %d): %s"
                    .formatted(response.statusCode(), response.body()));
        }
        return response.statusCode();
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
