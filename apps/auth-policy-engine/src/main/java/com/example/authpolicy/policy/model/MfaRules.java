package com.example.authpolicy.policy.model;

public record MfaRules(ActionSpec requirements) implements TypedRuleSet {

    @Override
    public PolicyType type() {
        return PolicyType.MFA;
    }
}
