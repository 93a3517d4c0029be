package com.example.authpolicy.policy.model;

import java.time.Duration;
import java.util.Set;

/**
 * Step-up rules: {@code requirements} only apply to {@code highRiskOperations}, and only to fresh evidence.
 */
public record StepUpRules(
        ActionSpec requirements,
        Set<String> highRiskOperations,
        Duration maxLastFactorAge,
        boolean requireFreshAuthentication
) implements TypedRuleSet {

    public StepUpRules {
        highRiskOperations = highRiskOperations == null ? Set.of() : Set.copyOf(highRiskOperations);
    }

    @Override
    public PolicyType type() {
        return PolicyType.STEP_UP;
    }

    public boolean isHighRisk(String operation) {
        return operation != null && highRiskOperations.contains(operation);
    }
}
