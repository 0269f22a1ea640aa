package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class SocialMediaValidator implements DomainValidator {

    static final int MAX_LENGTH = 280;

    @Override
    public ValidationResult validate(ValidationRequest request) {
        String text = request.output();
        int length = text.length();
        boolean toneOk = !text.startsWith("!!!");
        boolean passes = toneOk && length <= MAX_LENGTH;
        return new ValidationResult(passes,
                passes ? "tone and length within policy" : "tone/length violates policy",
                passes ? 1.0 : 0.0,
                Map.of("length", length, "tone_ok", toneOk));
    }
}
