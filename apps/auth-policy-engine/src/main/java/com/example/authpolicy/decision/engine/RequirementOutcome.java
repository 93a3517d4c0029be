package com.example.authpolicy.decision.engine;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.signal.model.FactorEvidence;

import java.util.List;
import java.util.Set;

/**
 * Result of counting evidence against an {@link com.example.authpolicy.policy.model.ActionSpec}.
 */
public record RequirementOutcome(
        boolean satisfied,
        List<FactorEvidence> satisfiedFactors,
        Set<FactorKind> missingMandatory,
        List<String> reasons
) {
    public RequirementOutcome {
        satisfiedFactors = List.copyOf(satisfiedFactors);
        missingMandatory = Set.copyOf(missingMandatory);
        reasons = List.copyOf(reasons);
    }

    public int distinctKinds() {
        return satisfiedFactors.size();
    }
}
