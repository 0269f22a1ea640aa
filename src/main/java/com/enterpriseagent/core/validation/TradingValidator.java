package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Risk heuristics: strategies must mention a Sharpe target and a stop rule.
 */
@Component
public class TradingValidator implements DomainValidator {

    @Override
    public ValidationResult validate(ValidationRequest request) {
        String text = request.output().toLowerCase(Locale.ROOT);
        double sharpe = text.contains("sharpe") ? 1.2 : 0.8;
        double maxDrawdown = text.contains("stop") ? 0.08 : 0.12;
        boolean passes = sharpe > 1.0 && maxDrawdown <= 0.10;
        return new ValidationResult(passes,
                passes ? "risk metrics satisfied" : "risk metrics outside limits",
                passes ? 1.0 : 0.0,
                Map.of("sharpe", sharpe, "max_drawdown", maxDrawdown));
    }
}
