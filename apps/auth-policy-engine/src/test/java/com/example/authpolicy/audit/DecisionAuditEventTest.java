package com.example.authpolicy.audit;

import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.decision.model.Verdict;
import com.example.authpolicy.policy.model.ExemptionRule;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.risk.RiskContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.authpolicy.util.EngineTestFixtures.NOW;
import static com.example.authpolicy.util.EngineTestFixtures.TENANT;
import static com.example.authpolicy.util.EvidenceTestBuilder.aPassword;
import static com.example.authpolicy.util.EvidenceTestBuilder.anOtpToken;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DecisionAuditEvent")
class DecisionAuditEventTest {

    private final EvaluationRequest request = new EvaluationRequest(TENANT, "customer", "standard", "eu", null,
            List.of(), RiskContext.builder().operation("payment").build(), NOW);

    @Test
    @DisplayName("should capture the decision with snake_case keys")
    void shouldCaptureDecision() {
        Decision decision = Decision.builder()
                .verdict(Verdict.ACCEPT)
                .satisfiedFactors(List.of(aPassword(), anOtpToken()))
                .riskTier(RiskTier.LOW)
                .riskScore(30)
                .appliedPolicyId("psd2")
                .appliedPolicyType(PolicyType.CONDITIONAL)
                .appliedExemption(new ExemptionRule.LowValuePayment(new BigDecimal("30"), null, null))
                .reasons(List.of("exemption LOW_VALUE_PAYMENT applied: amount 20 does not exceed 30"))
                .evaluatedAt(NOW)
                .registryVersion(4L)
                .build();

        Map<String, Object> log = DecisionAuditEvent.from(request, decision).toStructuredLog();

        assertThat(log)
                .containsEntry("event_type", "auth_decision")
                .containsEntry("outcome", "ACCEPT")
                .containsEntry("policy_id", "psd2")
                .containsEntry("policy_type", "CONDITIONAL")
                .containsEntry("exemption", "LOW_VALUE_PAYMENT")
                .containsEntry("risk_tier", "LOW")
                .containsEntry("registry_version", 4L)
                .containsEntry("operation", "payment")
                .containsEntry("satisfied_factors", List.of("KNOWLEDGE/KB-01-02", "POSSESSION/PB-01-01"))
                .containsKey("event_id");
    }

    @Test
    @DisplayName("should describe errors without a policy type")
    void shouldDescribeErrors() {
        DecisionAuditEvent event = DecisionAuditEvent.error(request, "PolicyNotFoundError", "no policy");

        assertThat(event.outcome()).isEqualTo(DecisionAuditEvent.Outcome.ERROR);
        assertThat(event.toStructuredLog())
                .containsEntry("policy_id", "PolicyNotFoundError")
                .containsEntry("policy_type", "")
                .containsEntry("reasons", List.of("no policy"));
    }

    @Test
    @DisplayName("should record the device, client address and emergency attestation")
    void shouldRecordRequestContext() {
        EvaluationRequest emergency = new EvaluationRequest(TENANT, "HUMAN", null, null, null, List.of(),
                RiskContext.builder()
                        .deviceId("device-7f3a")
                        .ipAddress("203.0.113.24")
                        .contextKeys(Set.of("emergency_access"))
                        .emergencyAttestation("INC-2041")
                        .build(),
                NOW);

        Map<String, Object> log = DecisionAuditEvent.error(emergency, "AmbiguousPolicyError", "tie").toStructuredLog();

        assertThat(log)
                .containsEntry("device_id", "device-7f3a")
                .containsEntry("client_ip", "203.0.113.24")
                .containsEntry("emergency_attestation", "INC-2041");
        assertThat(DecisionAuditEvent.error(request, "AmbiguousPolicyError", "tie").toStructuredLog())
                .containsEntry("device_id", "")
                .containsEntry("client_ip", "");
    }
}
