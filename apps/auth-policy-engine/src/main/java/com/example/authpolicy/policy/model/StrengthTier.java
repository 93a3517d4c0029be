package com.example.authpolicy.policy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Robustness classification of an authentication factor, in ascending order.
 */
public enum StrengthTier {
    BASIC,
    INTERMEDIATE,
    ADVANCED,
    VERY_ADVANCED;

    public boolean isAtLeast(StrengthTier minimum) {
        return minimum == null || compareTo(minimum) >= 0;
    }

    public static Optional<StrengthTier> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase();
        return Arrays.stream(values())
                .filter(tier -> tier.name().equals(normalized))
                .findFirst();
    }
}
