package com.example.authpolicy.policy.exception;

import com.example.authpolicy.policy.model.PolicyQuery;

/**
 * Evaluation in FAIL mode with no enabled policy in scope. The tenant's configuration is incomplete,
 * so this is reported as a configuration error rather than a missing resource.
 */
public class NoApplicablePolicyException extends PolicyEngineException {

    private final PolicyQuery query;

    public NoApplicablePolicyException(PolicyQuery query) {
        super("PolicyNotFoundError", String.format(
                "No enabled policy applies to tenant=%s, userType=%s, securityProfile=%s, region=%s",
                query.tenantId(), query.userType(), query.securityProfile(), query.region()));
        this.query = query;
    }

    public PolicyQuery getQuery() {
        return query;
    }
}
