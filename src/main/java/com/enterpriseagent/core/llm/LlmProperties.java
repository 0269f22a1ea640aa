package com.enterpriseagent.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agent.llm")
public class LlmProperties {

    private String openaiApiKey = "";
    private String anthropicApiKey = "";
    private String googleApiKey = "";

    /** Forces deterministic offline responses even when provider keys are present. */
    private boolean offline = false;

    /** Logical model name to provider-side model id, overriding the catalog aliases. */
    private Map<String, String> aliases = new HashMap<>();

    /** Independent second reviewer, added when its provider is available. */
    private String secondaryReviewer = ModelCatalog.CLAUDE_OPUS_4;

    /** Extra instructions prepended to every prompt of a role, keyed by lower-case role name. */
    private Map<String, String> promptEnhancements = new HashMap<>();

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public String getGoogleApiKey() {
        return googleApiKey;
    }

    public void setGoogleApiKey(String googleApiKey) {
        this.googleApiKey = googleApiKey;
    }

    public boolean isOffline() {
        return offline;
    }

    public void setOffline(boolean offline) {
        this.offline = offline;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public void setAliases(Map<String, String> aliases) {
        this.aliases = aliases;
    }

    public String getSecondaryReviewer() {
        return secondaryReviewer;
    }

    public void setSecondaryReviewer(String secondaryReviewer) {
        this.secondaryReviewer = secondaryReviewer;
    }

    public Map<String, String> getPromptEnhancements() {
        return promptEnhancements;
    }

    public void setPromptEnhancements(Map<String, String> promptEnhancements) {
        this.promptEnhancements = promptEnhancements;
    }

    public boolean hasAnthropicKey() {
        return !offline && anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    public boolean hasOpenaiKey() {
        return !offline && openaiApiKey != null && !openaiApiKey.isBlank();
    }

    public boolean hasGoogleKey() {
        return !offline && googleApiKey != null && !googleApiKey.isBlank();
    }

    public boolean isProviderAvailable(String provider) {
        return switch (provider) {
            case "openai" -> hasOpenaiKey();
            case "anthropic" -> hasAnthropicKey();
            case "google" -> hasGoogleKey();
            default -> false;
        };
    }

    public boolean hasAnyProvider() {
        return hasOpenaiKey() || hasAnthropicKey() || hasGoogleKey();
    }
}
