package com.example.authpolicy.policy.exception;

import java.util.List;

/**
 * Two or more candidates share type, priority and specificity. Must be fixed in configuration.
 */
public class AmbiguousPolicyException extends PolicyEngineException {

    private final List<String> policyIds;

    public AmbiguousPolicyException(List<String> policyIds) {
        super("AmbiguousPolicyError", "Ambiguous policies with equal type, priority and specificity: " + policyIds);
        this.policyIds = List.copyOf(policyIds);
    }

    public List<String> getPolicyIds() {
        return policyIds;
    }
}
