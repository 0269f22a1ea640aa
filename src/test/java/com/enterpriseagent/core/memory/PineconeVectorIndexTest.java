package com.enterpriseagent.core.memory;

import com.enterpriseagent.core.http.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PineconeVectorIndexTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void upsertBodyCarriesVectorAndNamespace() throws Exception {
        var props = new MemoryProperties.Pinecone();
        props.setNamespace("agents");
        var index = new PineconeVectorIndex(props, mock(HttpClient.class), mapper,
                new RetryPolicy(1, Duration.ZERO, 1.0));

        var body = mapper.readTree(index.upsertBody("plan", new float[]{0.5f, 0.5f}, Map.of("level", "session")));

        var vector = body.get("vectors").get(0);
        assertEquals("plan", vector.get("id").asText());
        assertEquals(2, vector.get("values").size());
        assertEquals("session", vector.get("metadata").get("level").asText());
        assertEquals("agents", body.get("namespace").asText());
    }

    @Test
    void namespaceOmittedWhenBlank() throws Exception {
        var index = new PineconeVectorIndex(new MemoryProperties.Pinecone(), mock(HttpClient.class), mapper,
                new RetryPolicy(1, Duration.ZERO, 1.0));

        var body = mapper.readTree(index.upsertBody("k", new float[]{1f}, Map.of()));

        assertFalse(body.has("namespace"));
    }
}
