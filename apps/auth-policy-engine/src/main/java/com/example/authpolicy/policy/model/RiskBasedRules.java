package com.example.authpolicy.policy.model;

import java.util.Map;

/**
 * Risk-based rules: one action per tier, scored with the engine's default risk model.
 */
public record RiskBasedRules(Map<RiskTier, ActionSpec> riskLevels) implements TypedRuleSet, TieredRules {

    public RiskBasedRules {
        riskLevels = riskLevels == null ? Map.of() : Map.copyOf(riskLevels);
    }

    @Override
    public PolicyType type() {
        return PolicyType.RISK_BASED;
    }

    @Override
    public Map<RiskTier, ActionSpec> actionsByTier() {
        return riskLevels;
    }
}
