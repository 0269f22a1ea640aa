package com.enterpriseagent.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tolerant JSON parsing for model responses.
 * <p>
 * Tries the whole response (with Markdown code fences removed), then the
 * outermost {@code {...}} span inside it.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private final ObjectMapper mapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
    }

    /**
     * @throws LlmParseException when no JSON object of the requested type can be extracted
     */
    public <T> T parse(String response, Class<T> type) {
        if (response == null || response.isBlank()) {
            throw new LlmParseException("Empty response cannot be parsed to " + type.getSimpleName());
        }
        String cleaned = stripFences(response.trim());
        try {
            return mapper.readValue(cleaned, type);
        } catch (Exception first) {
            int open = cleaned.indexOf('{');
            int close = cleaned.lastIndexOf('}');
            if (open >= 0 && close > open) {
                try {
                    return mapper.readValue(cleaned.substring(open, close + 1), type);
                } catch (Exception second) {
                    log.debug("Embedded JSON parse failed for {}: {}", type.getSimpleName(), second.getMessage());
                }
            }
            throw new LlmParseException("Failed to parse LLM response to " + type.getSimpleName()
                    + ": " + first.getMessage(), first);
        }
    }

    /**
     * Never throws: falls back to the raw text when the response does not parse.
     */
    public <T> ParsedResponse<T> parseOrRaw(String response, Class<T> type) {
        try {
            T value = parse(response, type);
            return value != null ? ParsedResponse.structured(value, response) : ParsedResponse.raw(response);
        } catch (LlmParseException e) {
            log.info("Using raw text fallback after JSON parse failure for {}", type.getSimpleName());
            return ParsedResponse.raw(response == null ? "" : response);
        }
    }

    static String stripFences(String text) {
        String cleaned = text;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
