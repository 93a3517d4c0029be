package com.example.authpolicy.policy.model;

/**
 * Lower bounds of the LOW, MEDIUM and HIGH tiers. A score equal to a bound belongs to that bound's tier.
 */
public record RiskThresholds(double low, double medium, double high) {

    public boolean isStrictlyAscending() {
        return low < medium && medium < high;
    }

    public RiskTier tierFor(double score) {
        if (score >= high) {
            return RiskTier.HIGH;
        }
        if (score >= medium) {
            return RiskTier.MEDIUM;
        }
        if (score >= low) {
            return RiskTier.LOW;
        }
        return RiskTier.NONE;
    }
}
