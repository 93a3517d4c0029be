package com.example.authpolicy.signal.model;

import com.example.authpolicy.policy.model.StrengthTier;

import java.time.Instant;

/**
 * Raw result reported by a factor verifier (OTP check, WebAuthn assertion, biometric match...).
 * {@code kind}, {@code score} and {@code strength} are optional and filled in from the method catalog.
 */
public record VerifierOutcome(
        String kind,
        String methodId,
        boolean valid,
        Double score,
        StrengthTier strength,
        Instant observedAt
) {
}
