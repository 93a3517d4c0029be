package com.example.authpolicy.policy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Declared policy type. Each type owns exactly one {@link TypedRuleSet} variant.
 */
public enum PolicyType {
    MFA,
    STEP_UP,
    ADAPTIVE,
    RISK_BASED,
    CONDITIONAL;

    /**
     * Lenient lookup used when parsing policy documents ("step-up", "Step_Up" and "STEP_UP" all match).
     */
    public static Optional<PolicyType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase();
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }
}
