package com.example.authpolicy.decision.dto;

import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.signal.model.VerifierOutcome;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Verifier outcome as sent by the caller.
 */
public record EvidenceItem(
        @Nullable String kind,
        @NotBlank String methodId,
        @NotNull Boolean valid,
        @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double score,
        @Nullable String strength,
        @NotNull Instant observedAt
) {
    public VerifierOutcome toOutcome() {
        StrengthTier tier = null;
        if (strength != null) {
            tier = StrengthTier.fromValue(strength)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown strength tier: " + strength));
        }
        return new VerifierOutcome(kind, methodId, valid, score, tier, observedAt);
    }
}
