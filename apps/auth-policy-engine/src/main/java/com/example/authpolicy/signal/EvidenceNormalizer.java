package com.example.authpolicy.signal;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.signal.model.FactorEvidence;
import com.example.authpolicy.signal.model.VerifierOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns verifier outcomes into {@link FactorEvidence}. Failed verifications never become evidence.
 *
 * <p>Each outcome is routed by factor kind to the registered {@link FactorVerifier}; kinds without
 * one use a {@link CatalogFactorVerifier}.
 */
@Slf4j
@Component
public class EvidenceNormalizer {

    private final MethodCatalog methodCatalog;
    private final Map<FactorKind, FactorVerifier> verifiers = new EnumMap<>(FactorKind.class);

    public EvidenceNormalizer(MethodCatalog methodCatalog, List<FactorVerifier> customVerifiers) {
        this.methodCatalog = methodCatalog;
        for (FactorVerifier verifier : customVerifiers) {
            FactorVerifier previous = verifiers.putIfAbsent(verifier.kind(), verifier);
            if (previous != null) {
                throw new IllegalStateException(String.format("Two factor verifiers registered for %s: %s and %s",
                        verifier.kind(), previous.getClass().getSimpleName(), verifier.getClass().getSimpleName()));
            }
            log.info("Using {} for {} factors", verifier.getClass().getSimpleName(), verifier.kind());
        }
        for (FactorKind kind : FactorKind.values()) {
            verifiers.putIfAbsent(kind, new CatalogFactorVerifier(kind, methodCatalog));
        }
    }

    public List<FactorEvidence> normalize(List<VerifierOutcome> outcomes) {
        if (outcomes == null) {
            return List.of();
        }
        List<FactorEvidence> evidence = new ArrayList<>(outcomes.size());
        for (VerifierOutcome outcome : outcomes) {
            if (!outcome.valid()) {
                log.debug("Skipping failed verification for method {}", outcome.methodId());
                continue;
            }
            FactorKind kind = kindOf(outcome);
            Optional<FactorEvidence> factor = verifiers.get(kind).verify(outcome);
            if (factor.isPresent()) {
                evidence.add(factor.get());
            } else {
                log.debug("{} verifier discarded outcome for method {}", kind, outcome.methodId());
            }
        }
        return evidence;
    }

    private FactorKind kindOf(VerifierOutcome outcome) {
        return FactorKind.fromValue(outcome.kind())
                .or(() -> methodCatalog.lookup(outcome.methodId()).map(MethodDescriptor::kind))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Cannot determine factor kind for method " + outcome.methodId()));
    }
}
