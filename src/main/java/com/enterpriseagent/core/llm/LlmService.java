package com.enterpriseagent.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for plain-text model calls.
 * <p>
 * All logical models are served through the one configured chat endpoint
 * (typically an OpenAI-compatible gateway); the logical name is resolved to the
 * provider-side id and passed as a per-call option.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized ({})", properties.hasAnyProvider()
                ? "providers available" : "offline responses only");
    }

    public boolean isAvailable() {
        return properties.hasAnyProvider();
    }

    /**
     * Sends {@code prompt} to {@code model} and returns the text with token usage.
     * Usage missing from the response is estimated at four characters per token.
     */
    public LlmResponse call(String model, String prompt) {
        String resolved = ModelCatalog.resolveAlias(model, properties.getAliases());
        log.info("LLM call started → {} ({})", model, resolved);
        long start = System.currentTimeMillis();

        ChatResponse response = chatClient.prompt()
                .options(ChatOptions.builder().model(resolved).build())
                .user(prompt)
                .call()
                .chatResponse();

        String text = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText()
                : null;
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", model, String.format("%.1f", elapsed / 1000.0));
        if (text == null || text.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for model " + model);
        }

        long promptTokens = prompt.length() / 4;
        long completionTokens = text.length() / 4;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null && usage.getPromptTokens() != null && usage.getPromptTokens() > 0) {
            promptTokens = usage.getPromptTokens();
        }
        if (usage != null && usage.getCompletionTokens() != null && usage.getCompletionTokens() > 0) {
            completionTokens = usage.getCompletionTokens();
        }
        return new LlmResponse(text, model, promptTokens, completionTokens);
    }
}
