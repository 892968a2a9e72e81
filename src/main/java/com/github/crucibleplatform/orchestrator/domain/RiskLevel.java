package com.github.crucibleplatform.orchestrator.domain;

import java.util.Arrays;

/**
 * Declared risk of the submitted code. Higher risk gets a shorter grace period before forced termination.
 *
 * @author crucible-platform
 */
public enum RiskLevel {
    TRUSTED,
    STANDARD,
    UNTRUSTED;

    public static RiskLevel fromString(final String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return Arrays.stream(values())
                .filter(riskLevel -> riskLevel.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + value));
    }

}
