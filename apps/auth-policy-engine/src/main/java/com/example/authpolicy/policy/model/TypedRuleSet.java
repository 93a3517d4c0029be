package com.example.authpolicy.policy.model;

/**
 * Closed set of rule shapes, one per {@link PolicyType}.
 */
public sealed interface TypedRuleSet
        permits MfaRules, StepUpRules, AdaptiveRules, RiskBasedRules, ConditionalRules {

    PolicyType type();
}
