package com.example.authpolicy.policy.model;

import java.time.Duration;
import java.util.Set;

/**
 * Factor requirements applied once a policy has decided how strict to be.
 *
 * @param requiredFactors           number of distinct factor kinds that must be satisfied
 * @param allowedMethods            method ids that may contribute a factor
 * @param minimumFactorStrength     weakest strength a contributing factor may have
 * @param mandatoryFactorCategories kinds that must be among the satisfied ones (e.g. PSD2 knowledge + possession)
 * @param maxSessionDuration        optional cap on the session established by this decision
 */
public record ActionSpec(
        int requiredFactors,
        Set<String> allowedMethods,
        StrengthTier minimumFactorStrength,
        Set<FactorKind> mandatoryFactorCategories,
        Duration maxSessionDuration
) {
    public ActionSpec {
        allowedMethods = allowedMethods == null ? Set.of() : Set.copyOf(allowedMethods);
        if (minimumFactorStrength == null) {
            minimumFactorStrength = StrengthTier.BASIC;
        }
        mandatoryFactorCategories = mandatoryFactorCategories == null
                ? Set.of()
                : Set.copyOf(mandatoryFactorCategories);
    }

    public static ActionSpec of(int requiredFactors, Set<String> allowedMethods, StrengthTier minimumFactorStrength) {
        return new ActionSpec(requiredFactors, allowedMethods, minimumFactorStrength, Set.of(), null);
    }

    /**
     * Relaxed copy used when an exemption applies: nothing is required any more.
     */
    public ActionSpec exempted() {
        return new ActionSpec(0, allowedMethods, minimumFactorStrength, Set.of(), maxSessionDuration);
    }

    /**
     * Copy whose session is capped at {@code cap}. A shorter existing cap is kept.
     */
    public ActionSpec withSessionCap(Duration cap) {
        Duration capped = maxSessionDuration != null && maxSessionDuration.compareTo(cap) < 0
                ? maxSessionDuration
                : cap;
        return new ActionSpec(requiredFactors, allowedMethods, minimumFactorStrength, mandatoryFactorCategories, capped);
    }

    public boolean allowsMethod(String methodId) {
        return methodId != null && allowedMethods.contains(methodId);
    }
}
