package com.enterpriseagent.core.memory;

import com.enterpriseagent.core.http.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds a fresh {@link MemoryStore} per run from configuration.
 */
@Component
public class MemoryStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(MemoryStoreFactory.class);

    private final MemoryProperties properties;
    private final VectorIndex vectorIndex;
    private final Clock clock;

    public MemoryStoreFactory(MemoryProperties properties, ObjectMapper objectMapper) {
        this(properties, buildIndex(properties, objectMapper), Clock.systemUTC());
    }

    MemoryStoreFactory(MemoryProperties properties, VectorIndex vectorIndex, Clock clock) {
        this.properties = properties;
        this.vectorIndex = vectorIndex;
        this.clock = clock;
    }

    public MemoryStore create() {
        return new MemoryStore(properties.getTypes(), properties.getRetentionDays(), vectorIndex, clock);
    }

    private static VectorIndex buildIndex(MemoryProperties properties, ObjectMapper objectMapper) {
        if (!properties.isHybrid()) {
            return null;
        }
        if (!properties.getPinecone().isConfigured()) {
            log.warn("Memory storage '{}' requested but Pinecone is not configured; using in-process memory only",
                    properties.getStorage());
            return null;
        }
        log.info("Memory writes mirrored to Pinecone index {}", properties.getPinecone().getIndexHost());
        return new PineconeVectorIndex(properties.getPinecone(), objectMapper, RetryPolicy.standard());
    }
}
