package com.example.authpolicy.signal.model;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One verified observation of an authentication factor.
 *
 * @param kind       factor category
 * @param methodId   catalog method code, e.g. {@code KB-01-02}
 * @param score      verifier confidence in [0, 1]
 * @param observedAt when the factor was verified
 * @param strength   robustness of the method as verified
 */
public record FactorEvidence(
        FactorKind kind,
        String methodId,
        double score,
        Instant observedAt,
        StrengthTier strength
) {
    public FactorEvidence {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(methodId, "methodId");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(strength, "strength");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
    }

    public static FactorEvidence of(FactorKind kind, String methodId, StrengthTier strength, Instant observedAt) {
        return new FactorEvidence(kind, methodId, 1.0, observedAt, strength);
    }

    /**
     * Strictly older than {@code maxAge}. Evidence observed exactly {@code maxAge} ago is still fresh.
     */
    public boolean isOlderThan(Duration maxAge, Instant now) {
        return observedAt.isBefore(now.minus(maxAge));
    }

    public String label() {
        return kind + "/" + methodId;
    }
}
