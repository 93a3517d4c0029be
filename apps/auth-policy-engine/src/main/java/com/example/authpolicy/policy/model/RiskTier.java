package com.example.authpolicy.policy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bucketed outcome of risk scoring. {@code NONE} is a score below the lowest threshold.
 */
public enum RiskTier {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public static Optional<RiskTier> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(tier -> tier.name().equals(normalized))
                .findFirst();
    }
}
