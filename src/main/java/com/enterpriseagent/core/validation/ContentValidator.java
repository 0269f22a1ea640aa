package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Readability (average words per sentence) and originality.
 * <p>
 * No originality source is wired in, so duplication is reported as 0.0 and
 * only readability can fail the check.
 */
@Component
public class ContentValidator implements DomainValidator {

    static final double MAX_AVG_SENTENCE_LENGTH = 25.0;
    static final double MAX_DUPLICATION = 0.05;
    static final double DUPLICATION = 0.0;

    @Override
    public ValidationResult validate(ValidationRequest request) {
        String text = request.output();
        int sentenceMarks = countChar(text, '.') + countChar(text, '!');
        int sentences = Math.max(sentenceMarks, 1);
        String trimmed = text.trim();
        int words = Math.max(trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length, 1);
        double avgSentence = (double) words / sentences;
        double duplication = DUPLICATION;

        boolean passes = avgSentence <= MAX_AVG_SENTENCE_LENGTH && duplication < MAX_DUPLICATION;
        return new ValidationResult(passes,
                passes ? "readability and originality healthy" : "readability/originality below target",
                passes ? 1.0 : 0.0,
                Map.of("avg_sentence_length", avgSentence, "duplication", duplication));
    }

    private static int countChar(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
