package com.example.authpolicy.decision.dto;

import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.signal.model.FactorEvidence;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decision as returned over HTTP.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(
        String verdict,
        List<SatisfiedFactor> satisfiedFactors,
        String riskTier,
        double riskScore,
        String appliedPolicyId,
        String appliedPolicyType,
        String appliedExemption,
        Duration maxSessionDuration,
        List<String> reasons,
        Instant evaluatedAt,
        long registryVersion
) {
    public record SatisfiedFactor(String kind, String methodId, String strength, Instant observedAt) {
        static SatisfiedFactor from(FactorEvidence evidence) {
            return new SatisfiedFactor(evidence.kind().name(), evidence.methodId(), evidence.strength().name(),
                    evidence.observedAt());
        }
    }

    public static DecisionResponse from(Decision decision) {
        return new DecisionResponse(
                decision.verdict().name(),
                decision.satisfiedFactors().stream().map(SatisfiedFactor::from).toList(),
                decision.riskTier() != null ? decision.riskTier().name() : null,
                decision.riskScore(),
                decision.appliedPolicyId(),
                decision.appliedPolicyType() != null ? decision.appliedPolicyType().name() : null,
                decision.appliedExemption() != null ? decision.appliedExemption().code() : null,
                decision.maxSessionDuration(),
                decision.reasons(),
                decision.evaluatedAt(),
                decision.registryVersion()
        );
    }
}
