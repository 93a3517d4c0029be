package com.example.authpolicy.policy.model;

import java.util.Map;
import java.util.Optional;

/**
 * Rule sets that pick their {@link ActionSpec} from a computed {@link RiskTier}.
 */
public interface TieredRules {

    Map<RiskTier, ActionSpec> actionsByTier();

    /**
     * NONE falls back to the LOW action unless the policy declares a NONE action of its own.
     */
    default Optional<ActionSpec> actionFor(RiskTier tier) {
        ActionSpec spec = actionsByTier().get(tier);
        if (spec == null && tier == RiskTier.NONE) {
            spec = actionsByTier().get(RiskTier.LOW);
        }
        return Optional.ofNullable(spec);
    }
}
