package com.example.authpolicy.decision.model;

import com.example.authpolicy.policy.model.PolicyQuery;
import com.example.authpolicy.risk.RiskContext;
import com.example.authpolicy.signal.model.FactorEvidence;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything an evaluation depends on. {@code now} is explicit so that equal requests
 * against the same registry version produce equal decisions.
 */
public record EvaluationRequest(
        String tenantId,
        String userType,
        String securityProfile,
        String region,
        String operation,
        List<FactorEvidence> evidence,
        RiskContext riskContext,
        Instant now
) {
    public EvaluationRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(now, "now");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        riskContext = riskContext == null ? RiskContext.empty() : riskContext;
    }

    public PolicyQuery query() {
        return new PolicyQuery(tenantId, userType, securityProfile, region);
    }

    /**
     * The request operation, or the one carried by the risk context.
     */
    public String effectiveOperation() {
        return operation != null ? operation : riskContext.operation();
    }
}
