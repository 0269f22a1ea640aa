package com.enterpriseagent.core.memory;

import java.io.Serializable;
import java.time.Instant;

/**
 * A stored value with the time it was written.
 */
public record MemoryRecord(Object value, Instant createdAt) implements Serializable {
}
