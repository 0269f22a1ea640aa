package com.enterpriseagent.core.llm;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Logical model names known to the router, with provider, provider-side alias and pricing.
 */
public final class ModelCatalog {

    public static final String OPENAI_GPT_5 = "openai_gpt_5";
    public static final String OPENAI_GPT_5_CODEX = "openai_gpt_5_codex";
    public static final String CLAUDE_SONNET_4 = "claude_sonnet_4";
    public static final String CLAUDE_OPUS_4 = "claude_opus_4";
    public static final String GEMINI_2_5_PRO = "gemini-2.5-pro";

    /** Model name recorded for offline responses. */
    public static final String STUB_MODEL = "stub";

    /** Per-million rate charged for models missing from the catalog. */
    public static final double NOMINAL_RATE_PER_1M = 0.001;

    public record ModelInfo(
            String id,
            String provider,
            String alias,
            double inputPricePer1M,
            double outputPricePer1M,
            String description
    ) {
        public double cost(long inputTokens, long outputTokens) {
            return inputTokens / 1_000_000.0 * inputPricePer1M
                    + outputTokens / 1_000_000.0 * outputPricePer1M;
        }

        public String priceDisplay() {
            return String.format("$%.2f / $%.2f per 1M tokens", inputPricePer1M, outputPricePer1M);
        }
    }

    public static final List<ModelInfo> MODELS = List.of(
            new ModelInfo(OPENAI_GPT_5, "openai", "gpt-4-turbo", 1.25, 10.00,
                    "General purpose OpenAI model"),
            new ModelInfo(OPENAI_GPT_5_CODEX, "openai", "gpt-4-turbo", 1.25, 10.00,
                    "Code-specialised OpenAI model, also served through the Codex CLI"),
            new ModelInfo(CLAUDE_SONNET_4, "anthropic", "claude-3-5-sonnet-20240620", 3.00, 15.00,
                    "Balanced Anthropic model"),
            new ModelInfo(CLAUDE_OPUS_4, "anthropic", "claude-3-opus-20240229", 15.00, 75.00,
                    "Most capable Anthropic model, used for security-sensitive work"),
            new ModelInfo(GEMINI_2_5_PRO, "google", "gemini-1.5-pro-latest", 0.50, 5.00,
                    "Google long-context model")
    );

    private static final Map<String, ModelInfo> BY_ID = MODELS.stream()
            .collect(Collectors.toUnmodifiableMap(ModelInfo::id, Function.identity()));

    private ModelCatalog() {
    }

    public static Optional<ModelInfo> findModel(String id) {
        return Optional.ofNullable(id == null ? null : BY_ID.get(id));
    }

    /**
     * Pricing for a model; unknown names get the nominal rate rather than an error.
     */
    public static ModelInfo pricing(String id) {
        return findModel(id).orElseGet(() -> new ModelInfo(
                id, providerOf(id), id, NOMINAL_RATE_PER_1M, NOMINAL_RATE_PER_1M, "Unlisted model"));
    }

    /**
     * Provider inferred from a logical or provider-side model name; empty when unrecognised.
     */
    public static String providerOf(String id) {
        if (id == null || id.isBlank()) {
            return "";
        }
        var known = BY_ID.get(id);
        if (known != null) {
            return known.provider();
        }
        String lower = id.toLowerCase(Locale.ROOT);
        if (lower.contains("gpt") || lower.contains("openai") || lower.startsWith("o1") || lower.startsWith("o3")) {
            return "openai";
        }
        if (lower.contains("claude") || lower.contains("anthropic")) {
            return "anthropic";
        }
        if (lower.contains("gemini") || lower.contains("google")) {
            return "google";
        }
        return "";
    }

    /**
     * Provider-side model identifier; overrides take precedence over the catalog alias.
     */
    public static String resolveAlias(String id, Map<String, String> overrides) {
        if (overrides != null) {
            String override = overrides.get(id);
            if (override != null && !override.isBlank()) {
                return override;
            }
        }
        return findModel(id).map(ModelInfo::alias).orElse(id);
    }
}
