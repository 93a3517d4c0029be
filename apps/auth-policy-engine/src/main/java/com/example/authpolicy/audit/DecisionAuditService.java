package com.example.authpolicy.audit;

import com.example.authpolicy.common.util.StringSanitizer;
import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Publishes authentication decisions as structured JSON on the {@code AUTH_DECISION_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.engine.audit.enabled", havingValue = "true", matchIfMissing = true)
public class DecisionAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTH_DECISION_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(@NonNull EvaluationRequest request, @NonNull Decision decision) {
        logEvent(DecisionAuditEvent.from(request, decision));
    }

    public void logError(@NonNull EvaluationRequest request, @NonNull String errorCode, @NonNull String reason) {
        logEvent(DecisionAuditEvent.error(request, errorCode, reason));
    }

    private void logEvent(@NonNull DecisionAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(DecisionAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ACCEPT -> AUDIT_LOG.info(json);
            case REJECT, STEP_UP_REQUIRED -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull DecisionAuditEvent event) {
        AUDIT_LOG.warn("AuthN {} - tenant={}, policy={}, tier={}, exemption={}",
                event.outcome(),
                StringSanitizer.forLog(event.tenantId()),
                StringSanitizer.forLog(event.policyId()),
                event.riskTier(),
                event.exemption());
    }
}
