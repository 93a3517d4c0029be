package com.example.authpolicy.signal;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.signal.model.FactorEvidence;
import com.example.authpolicy.signal.model.VerifierOutcome;

import java.util.Optional;

/**
 * Default verifier: takes the verifier's report as-is and fills strength from the method catalog.
 * Missing strength falls back to BASIC, missing score to 1.0.
 */
public class CatalogFactorVerifier implements FactorVerifier {

    private final FactorKind kind;
    private final MethodCatalog methodCatalog;

    public CatalogFactorVerifier(FactorKind kind, MethodCatalog methodCatalog) {
        this.kind = kind;
        this.methodCatalog = methodCatalog;
    }

    @Override
    public FactorKind kind() {
        return kind;
    }

    @Override
    public Optional<FactorEvidence> verify(VerifierOutcome outcome) {
        if (!outcome.valid()) {
            return Optional.empty();
        }
        StrengthTier strength = outcome.strength() != null
                ? outcome.strength()
                : methodCatalog.lookup(outcome.methodId())
                        .map(MethodDescriptor::nominalStrength)
                        .orElse(StrengthTier.BASIC);
        double score = outcome.score() != null ? outcome.score() : 1.0;
        return Optional.of(new FactorEvidence(kind, outcome.methodId(), score, outcome.observedAt(), strength));
    }
}
