package com.example.authpolicy.policy.exception;

import com.example.authpolicy.policy.model.RiskTier;

public class IncompleteActionSpecException extends PolicyEngineException {

    private final String policyId;
    private final RiskTier tier;

    public IncompleteActionSpecException(String policyId, RiskTier tier) {
        super("IncompleteActionSpecError",
                String.format("Policy %s defines no action for reachable risk tier %s", policyId, tier));
        this.policyId = policyId;
        this.tier = tier;
    }

    public String getPolicyId() {
        return policyId;
    }

    public RiskTier getTier() {
        return tier;
    }
}
