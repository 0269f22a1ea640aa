package com.enterpriseagent.core.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agent.memory")
public class MemoryProperties {

    /** Scopes created up front for each store. */
    private List<String> types = new ArrayList<>(List.of("session"));

    /** Records older than this are removed by prune. */
    private int retentionDays = 30;

    /** "memory" keeps records in process; "hybrid" also mirrors writes to the vector index. */
    private String storage = "memory";

    private Pinecone pinecone = new Pinecone();

    public List<String> getTypes() {
        return types;
    }

    public void setTypes(List<String> types) {
        this.types = types;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public String getStorage() {
        return storage;
    }

    public void setStorage(String storage) {
        this.storage = storage;
    }

    public Pinecone getPinecone() {
        return pinecone;
    }

    public void setPinecone(Pinecone pinecone) {
        this.pinecone = pinecone;
    }

    public boolean isHybrid() {
        return storage != null && storage.startsWith("hybrid");
    }

    public static class Pinecone {

        private String apiKey = "";

        /** Index host, e.g. https://memory-index-abc123.svc.us-east-1.pinecone.io */
        private String indexHost = "";

        private String namespace = "";

        private int dimension = 8;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getIndexHost() {
            return indexHost;
        }

        public void setIndexHost(String indexHost) {
            this.indexHost = indexHost;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && indexHost != null && !indexHost.isBlank();
        }
    }
}
