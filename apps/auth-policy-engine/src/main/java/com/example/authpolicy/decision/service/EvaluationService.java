package com.example.authpolicy.decision.service;

import com.example.authpolicy.audit.DecisionAuditService;
import com.example.authpolicy.decision.engine.AuthenticationPolicyEngine;
import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.observability.metrics.DecisionMetrics;
import com.example.authpolicy.policy.exception.PolicyEngineException;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs evaluations and records their audit trail and metrics.
 */
@Slf4j
@Service
public class EvaluationService {

    private final AuthenticationPolicyEngine engine;
    private final DecisionMetrics metrics;

    @Nullable
    private final DecisionAuditService auditService;

    public EvaluationService(
            AuthenticationPolicyEngine engine,
            DecisionMetrics metrics,
            @Nullable DecisionAuditService auditService) {
        this.engine = engine;
        this.metrics = metrics;
        this.auditService = auditService;
    }

    /**
     * Evaluate a request. Configuration errors are audited and propagated as
     * {@link PolicyEngineException}.
     *
     * @param request the evaluation request
     * @return Mono emitting the decision
     */
    public Mono<Decision> evaluate(EvaluationRequest request) {
        return Mono.fromCallable(() -> {
            Timer.Sample sample = metrics.startEvaluation();
            try {
                return engine.evaluate(request);
            } finally {
                metrics.stopEvaluation(sample);
            }
        }).doOnNext(decision -> {
            metrics.recordDecision(decision);
            if (auditService != null) {
                auditService.logDecision(request, decision);
            }
        }).doOnError(PolicyEngineException.class, e -> {
            log.error("Evaluation failed for tenant {}: {} {}", request.tenantId(), e.getErrorCode(), e.getMessage());
            metrics.recordError(e.getErrorCode());
            if (auditService != null) {
                auditService.logError(request, e.getErrorCode(), e.getMessage());
            }
        });
    }
}
