package com.example.authpolicy.audit;

import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.decision.model.Verdict;
import com.example.authpolicy.signal.model.FactorEvidence;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for authentication decisions.
 */
public record DecisionAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        String policyId,
        String policyType,
        String exemption,
        String riskTier,
        double riskScore,
        List<String> satisfiedFactors,
        List<String> reasons,
        long registryVersion,

        // Request
        String tenantId,
        String userType,
        String securityProfile,
        String region,
        String operation,

        // Request context
        String deviceId,
        String clientIp,
        String emergencyAttestation
) {
    public enum Outcome {
        ACCEPT, REJECT, STEP_UP_REQUIRED, ERROR
    }

    public static DecisionAuditEvent from(EvaluationRequest request, Decision decision) {
        return new DecisionAuditEvent(
                UUID.randomUUID().toString(),
                decision.evaluatedAt(),
                toOutcome(decision.verdict()),
                decision.appliedPolicyId(),
                decision.appliedPolicyType() != null ? decision.appliedPolicyType().name() : null,
                decision.appliedExemption() != null ? decision.appliedExemption().code() : null,
                decision.riskTier() != null ? decision.riskTier().name() : null,
                decision.riskScore(),
                decision.satisfiedFactors().stream().map(FactorEvidence::label).toList(),
                decision.reasons(),
                decision.registryVersion(),
                request.tenantId(),
                request.userType(),
                request.securityProfile(),
                request.region(),
                request.effectiveOperation(),
                request.riskContext().deviceId(),
                request.riskContext().ipAddress(),
                request.riskContext().emergencyAttestation()
        );
    }

    public static DecisionAuditEvent error(EvaluationRequest request, String errorCode, String errorReason) {
        return new DecisionAuditEvent(
                UUID.randomUUID().toString(),
                request.now(),
                Outcome.ERROR,
                errorCode,
                null,
                null,
                null,
                0.0,
                List.of(),
                List.of(errorReason),
                -1L,
                request.tenantId(),
                request.userType(),
                request.securityProfile(),
                request.region(),
                request.effectiveOperation(),
                request.riskContext().deviceId(),
                request.riskContext().ipAddress(),
                request.riskContext().emergencyAttestation()
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "auth_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp != null ? timestamp.toString() : ""),
                Map.entry("outcome", outcome.name()),
                Map.entry("policy_id", policyId != null ? policyId : ""),
                Map.entry("policy_type", policyType != null ? policyType : ""),
                Map.entry("exemption", exemption != null ? exemption : ""),
                Map.entry("risk_tier", riskTier != null ? riskTier : ""),
                Map.entry("risk_score", riskScore),
                Map.entry("satisfied_factors", satisfiedFactors),
                Map.entry("reasons", reasons),
                Map.entry("registry_version", registryVersion),
                Map.entry("tenant_id", tenantId != null ? tenantId : ""),
                Map.entry("user_type", userType != null ? userType : ""),
                Map.entry("security_profile", securityProfile != null ? securityProfile : ""),
                Map.entry("region", region != null ? region : ""),
                Map.entry("operation", operation != null ? operation : ""),
                Map.entry("device_id", deviceId != null ? deviceId : ""),
                Map.entry("client_ip", clientIp != null ? clientIp : ""),
                Map.entry("emergency_attestation", emergencyAttestation != null ? emergencyAttestation : "")
        );
    }

    private static Outcome toOutcome(Verdict verdict) {
        return switch (verdict) {
            case ACCEPT -> Outcome.ACCEPT;
            case REJECT -> Outcome.REJECT;
            case STEP_UP_REQUIRED -> Outcome.STEP_UP_REQUIRED;
        };
    }
}
