package com.enterpriseagent.core.llm;

/**
 * Text returned by a model together with the token usage it reported.
 */
public record LlmResponse(String text, String model, long promptTokens, long completionTokens) {
}
