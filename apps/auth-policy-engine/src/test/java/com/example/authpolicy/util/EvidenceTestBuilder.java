package com.example.authpolicy.util;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.signal.model.FactorEvidence;

import java.time.Duration;
import java.time.Instant;

/**
 * Test builder for FactorEvidence. Defaults to a fresh, fully trusted password factor.
 */
public class EvidenceTestBuilder {

    private FactorKind kind = FactorKind.KNOWLEDGE;
    private String methodId = "KB-01-02";
    private double score = 1.0;
    private Instant observedAt = EngineTestFixtures.NOW;
    private StrengthTier strength = StrengthTier.INTERMEDIATE;

    public static EvidenceTestBuilder anEvidence() {
        return new EvidenceTestBuilder();
    }

    public static FactorEvidence aPassword() {
        return anEvidence().build();
    }

    public static FactorEvidence anOtpToken() {
        return anEvidence()
                .withKind(FactorKind.POSSESSION)
                .withMethodId("PB-01-01")
                .withStrength(StrengthTier.ADVANCED)
                .build();
    }

    public static FactorEvidence aFingerprint() {
        return anEvidence()
                .withKind(FactorKind.BIOMETRIC)
                .withMethodId("IN-01-01")
                .withStrength(StrengthTier.ADVANCED)
                .build();
    }

    public EvidenceTestBuilder withKind(FactorKind kind) {
        this.kind = kind;
        return this;
    }

    public EvidenceTestBuilder withMethodId(String methodId) {
        this.methodId = methodId;
        return this;
    }

    public EvidenceTestBuilder withScore(double score) {
        this.score = score;
        return this;
    }

    public EvidenceTestBuilder withStrength(StrengthTier strength) {
        this.strength = strength;
        return this;
    }

    public EvidenceTestBuilder observedAt(Instant observedAt) {
        this.observedAt = observedAt;
        return this;
    }

    public EvidenceTestBuilder observedAgo(Duration age) {
        this.observedAt = EngineTestFixtures.NOW.minus(age);
        return this;
    }

    public FactorEvidence build() {
        return new FactorEvidence(kind, methodId, score, observedAt, strength);
    }
}
