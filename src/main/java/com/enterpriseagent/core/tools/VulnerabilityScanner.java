package com.enterpriseagent.core.tools;

import java.nio.file.Path;

/**
 * External vulnerability scanner consulted by the coding check.
 */
public interface VulnerabilityScanner {

    ScanResult scan(String payload, Path workspace);

    /**
     * Whether credentials and tooling for a real scan are present.
     */
    boolean isConfigured();
}
