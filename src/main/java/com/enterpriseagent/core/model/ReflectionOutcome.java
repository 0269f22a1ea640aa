package com.enterpriseagent.core.model;

import java.io.Serializable;

/**
 * Reflector output for one repair attempt.
 */
public record ReflectionOutcome(
        String output,
        boolean halt,
        int iterations,
        double confidence,
        String analysis,
        String model
) implements Serializable {
}
