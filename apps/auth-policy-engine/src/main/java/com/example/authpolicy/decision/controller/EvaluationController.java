package com.example.authpolicy.decision.controller;

import com.example.authpolicy.decision.dto.DecisionResponse;
import com.example.authpolicy.decision.dto.EvaluationRequestBody;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.decision.service.EvaluationService;
import com.example.authpolicy.risk.RiskContext;
import com.example.authpolicy.signal.EvidenceNormalizer;
import com.example.authpolicy.signal.model.FactorEvidence;
import com.example.authpolicy.decision.dto.EvidenceItem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/evaluations")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final EvidenceNormalizer evidenceNormalizer;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<DecisionResponse>> evaluate(@Valid @RequestBody EvaluationRequestBody body) {
        return Mono.fromCallable(() -> toRequest(body))
                .flatMap(evaluationService::evaluate)
                .map(decision -> ResponseEntity.ok(DecisionResponse.from(decision)));
    }

    private EvaluationRequest toRequest(EvaluationRequestBody body) {
        List<EvidenceItem> items = body.evidence() != null ? body.evidence() : List.of();
        List<FactorEvidence> evidence = evidenceNormalizer.normalize(
                items.stream().map(EvidenceItem::toOutcome).toList());
        RiskContext context = body.riskContext() != null
                ? body.riskContext().toRiskContext(body.operation())
                : RiskContext.builder().operation(body.operation()).build();

        log.debug("Evaluating tenant={}, operation={}, {} evidence items",
                body.tenantId(), body.operation(), evidence.size());
        return new EvaluationRequest(
                body.tenantId(),
                body.userType(),
                body.securityProfile(),
                body.region(),
                body.operation(),
                evidence,
                context,
                clock.instant());
    }
}
