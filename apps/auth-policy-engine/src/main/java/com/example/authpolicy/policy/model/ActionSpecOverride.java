package com.example.authpolicy.policy.model;

import java.time.Duration;
import java.util.Set;

/**
 * Partial {@link ActionSpec} attached to a conditional context rule.
 * Every field is optional; absent fields inherit from the base requirements.
 */
public record ActionSpecOverride(
        Integer requiredFactors,
        Set<String> allowedMethods,
        StrengthTier minimumFactorStrength,
        Set<FactorKind> mandatoryFactorCategories,
        Duration maxSessionDuration
) {
    public ActionSpec applyTo(ActionSpec base) {
        return new ActionSpec(
                requiredFactors != null ? requiredFactors : base.requiredFactors(),
                allowedMethods != null && !allowedMethods.isEmpty() ? allowedMethods : base.allowedMethods(),
                minimumFactorStrength != null ? minimumFactorStrength : base.minimumFactorStrength(),
                mandatoryFactorCategories != null ? mandatoryFactorCategories : base.mandatoryFactorCategories(),
                maxSessionDuration != null ? maxSessionDuration : base.maxSessionDuration()
        );
    }
}
