package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.tools.ToolProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Credentials handed to domain checks, built from configuration.
 */
@Component
public class SecretsProvider {

    private final ToolProperties toolProperties;

    public SecretsProvider(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    public Map<String, String> secrets() {
        var secrets = new HashMap<String, String>();
        if (toolProperties.getSnyk().hasToken()) {
            secrets.put(CodingValidator.SCANNER_TOKEN, toolProperties.getSnyk().getToken());
        }
        return secrets;
    }
}
