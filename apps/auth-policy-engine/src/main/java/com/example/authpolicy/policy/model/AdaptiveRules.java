package com.example.authpolicy.policy.model;

import java.util.Map;

/**
 * Adaptive rules: weights per risk signal name, tier cut points, one action per tier.
 */
public record AdaptiveRules(
        Map<String, Double> riskFactors,
        RiskThresholds riskThresholds,
        Map<RiskTier, ActionSpec> actions
) implements TypedRuleSet, TieredRules {

    public AdaptiveRules {
        riskFactors = riskFactors == null ? Map.of() : Map.copyOf(riskFactors);
        actions = actions == null ? Map.of() : Map.copyOf(actions);
    }

    @Override
    public PolicyType type() {
        return PolicyType.ADAPTIVE;
    }

    @Override
    public Map<RiskTier, ActionSpec> actionsByTier() {
        return actions;
    }
}
