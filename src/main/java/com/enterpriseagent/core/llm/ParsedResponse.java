package com.enterpriseagent.core.llm;

import java.util.Optional;

/**
 * A model response parsed into an expected shape, or the raw text when it did not fit.
 */
public record ParsedResponse<T>(T value, String rawText) {

    public static <T> ParsedResponse<T> structured(T value, String rawText) {
        return new ParsedResponse<>(value, rawText);
    }

    public static <T> ParsedResponse<T> raw(String rawText) {
        return new ParsedResponse<>(null, rawText);
    }

    public boolean isStructured() {
        return value != null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
