package com.example.authpolicy.risk;

import com.example.authpolicy.policy.model.RiskTier;

import java.util.List;

/**
 * Outcome of scoring a {@link RiskContext} against a {@link RiskModel}.
 *
 * @param contributingSignals signals whose weight was added, in name order
 */
public record RiskAssessment(
        double score,
        RiskTier tier,
        List<String> contributingSignals,
        List<String> reasons
) {
    public RiskAssessment {
        contributingSignals = List.copyOf(contributingSignals);
        reasons = List.copyOf(reasons);
    }
}
