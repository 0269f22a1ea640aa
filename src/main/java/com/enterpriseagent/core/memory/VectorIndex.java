package com.enterpriseagent.core.memory;

import java.util.Map;

/**
 * External vector index that mirrors memory writes for later semantic recall.
 */
public interface VectorIndex {

    /**
     * Best-effort upsert; implementations log failures instead of throwing.
     */
    void upsert(String id, float[] values, Map<String, Object> metadata);

    int dimension();
}
