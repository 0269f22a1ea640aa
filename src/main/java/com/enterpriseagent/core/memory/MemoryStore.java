package com.enterpriseagent.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scoped key/value memory with retention pruning.
 * <p>
 * One store belongs to one orchestrator; sharing across runs must be explicit.
 * When a {@link VectorIndex} is attached every write is mirrored into it.
 */
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    public static final String SESSION = "session";

    private final Map<String, Map<String, MemoryRecord>> scopes = new ConcurrentHashMap<>();
    private final Duration retention;
    private final VectorIndex vectorIndex;
    private final Clock clock;

    public MemoryStore() {
        this(List.of(SESSION), 30, null, Clock.systemUTC());
    }

    public MemoryStore(List<String> types, int retentionDays, VectorIndex vectorIndex, Clock clock) {
        this.retention = Duration.ofDays(retentionDays);
        this.vectorIndex = vectorIndex;
        this.clock = clock;
        for (String type : types == null || types.isEmpty() ? List.of(SESSION) : types) {
            scopes.put(type, new ConcurrentHashMap<>());
        }
    }

    public void store(String scope, String key, Object value) {
        scopes.computeIfAbsent(scope, s -> new ConcurrentHashMap<>())
                .put(key, new MemoryRecord(value, clock.instant()));
        log.debug("Stored memory {}/{}", scope, key);
        if (vectorIndex != null) {
            vectorIndex.upsert(key, embed(value, vectorIndex.dimension()), Map.of("level", scope, "key", key));
        }
    }

    public Object retrieve(String scope, String key) {
        return retrieve(scope, key, null);
    }

    public Object retrieve(String scope, String key, Object defaultValue) {
        var records = scopes.get(scope);
        if (records == null) {
            return defaultValue;
        }
        var record = records.get(key);
        return record != null ? record.value() : defaultValue;
    }

    /**
     * Removes every record older than the retention window.
     *
     * @return number of records removed
     */
    public int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (var records : scopes.values()) {
            var it = records.entrySet().iterator();
            while (it.hasNext()) {
                if (!it.next().getValue().createdAt().isAfter(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Pruned {} memory record(s) older than {} day(s)", removed, retention.toDays());
        }
        return removed;
    }

    public Set<String> scopes() {
        return Set.copyOf(scopes.keySet());
    }

    public Map<String, Object> snapshot(String scope) {
        var result = new LinkedHashMap<String, Object>();
        var records = scopes.get(scope);
        if (records != null) {
            records.forEach((key, record) -> result.put(key, record.value()));
        }
        return result;
    }

    /**
     * Deterministic hashed bag-of-bytes vector, stable across runs for the same value.
     */
    static float[] embed(Object value, int dimension) {
        float[] vector = new float[Math.max(1, dimension)];
        byte[] bytes = String.valueOf(value).getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            vector[(bytes[i] & 0xff) % vector.length] += 1f;
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            vector[0] = 1f;
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }
}
