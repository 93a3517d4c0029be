package com.example.authpolicy.signal;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.signal.model.FactorEvidence;
import com.example.authpolicy.signal.model.VerifierOutcome;

import java.util.Optional;

/**
 * Turns a successful verifier outcome of one factor kind into evidence.
 *
 * <p>Register an implementation as a bean to take over a kind. Kinds without one are handled by
 * {@link CatalogFactorVerifier}.
 */
public interface FactorVerifier {

    FactorKind kind();

    /**
     * @return empty when the outcome must not count as evidence
     */
    Optional<FactorEvidence> verify(VerifierOutcome outcome);
}
