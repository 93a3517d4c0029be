package com.example.authpolicy.policy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Category of authentication evidence. Distinct kinds are what MFA counting is based on.
 */
public enum FactorKind {
    KNOWLEDGE,
    POSSESSION,
    BIOMETRIC,
    BEHAVIORAL,
    DEVICE,
    GEO,
    BLOCKCHAIN,
    AI;

    public static Optional<FactorKind> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(normalized))
                .findFirst();
    }
}
