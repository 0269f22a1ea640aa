package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
public class RealEstateValidator implements DomainValidator {

    @Override
    public ValidationResult validate(ValidationRequest request) {
        String text = request.output().toLowerCase(Locale.ROOT);
        double capRate = text.contains("cap rate") ? 0.09 : 0.07;
        double dscr = text.contains("dscr") ? 1.3 : 1.1;
        boolean passes = capRate > 0.08 && dscr > 1.25;
        return new ValidationResult(passes,
                passes ? "cash flow healthy" : "financial ratios below threshold",
                passes ? 1.0 : 0.0,
                Map.of("cap_rate", capRate, "dscr", dscr));
    }
}
