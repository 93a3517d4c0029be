package com.example.authpolicy.decision.model;

import com.example.authpolicy.policy.model.ExemptionRule;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.signal.model.FactorEvidence;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one evaluation, with the trail of reasons that led to it.
 *
 * @param satisfiedFactors  one qualifying factor per counted kind
 * @param appliedPolicyType null when no policy was in scope and a default verdict was returned
 * @param appliedExemption  exemption that waived the factor requirement, if any
 * @param registryVersion   version of the registry snapshot the evaluation read
 */
@Builder
public record Decision(
        Verdict verdict,
        List<FactorEvidence> satisfiedFactors,
        RiskTier riskTier,
        double riskScore,
        String appliedPolicyId,
        PolicyType appliedPolicyType,
        ExemptionRule appliedExemption,
        Duration maxSessionDuration,
        List<String> reasons,
        Instant evaluatedAt,
        long registryVersion
) {
    public Decision {
        satisfiedFactors = satisfiedFactors == null ? List.of() : List.copyOf(satisfiedFactors);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPT;
    }
}
