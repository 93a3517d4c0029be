package com.example.authpolicy.decision.engine;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.config.properties.EngineProperties.NoPolicyBehavior;
import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.decision.model.Verdict;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.registry.PolicyRegistry;
import com.example.authpolicy.registry.PolicySnapshot;
import com.example.authpolicy.risk.RiskAssessment;
import com.example.authpolicy.risk.RiskModel;
import com.example.authpolicy.risk.RiskScorer;
import com.example.authpolicy.signal.SignalAggregator;
import com.example.authpolicy.signal.model.AggregatedSignals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates authentication requests against the policy registry.
 *
 * <p>Pure with respect to its inputs: the same request against the same registry version
 * yields the same decision.
 */
@Slf4j
@Component
public class AuthenticationPolicyEngine {

    public static final String DEFAULT_DENY = "DEFAULT_DENY";
    public static final String DEFAULT_ALLOW = "DEFAULT_ALLOW";

    private final PolicyRegistry registry;
    private final SignalAggregator aggregator;
    private final RiskScorer riskScorer;
    private final DecisionResolver resolver;
    private final RiskModel defaultRiskModel;
    private final NoPolicyBehavior noPolicyBehavior;

    public AuthenticationPolicyEngine(
            PolicyRegistry registry,
            SignalAggregator aggregator,
            RiskScorer riskScorer,
            DecisionResolver resolver,
            EngineProperties properties) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.riskScorer = riskScorer;
        this.resolver = resolver;
        this.defaultRiskModel = RiskModel.of(properties.getDefaultRiskModel());
        this.noPolicyBehavior = properties.getNoPolicyBehavior();
    }

    public Decision evaluate(EvaluationRequest request) {
        PolicySnapshot snapshot = registry.snapshot();

        List<Policy> candidates = noPolicyBehavior == NoPolicyBehavior.FAIL
                ? snapshot.requireCandidates(request.query())
                : snapshot.resolveCandidates(request.query());

        AggregatedSignals signals = aggregator.aggregate(request.evidence(), request.now());
        RiskAssessment baseline = riskScorer.assess(defaultRiskModel, request.riskContext());

        if (candidates.isEmpty()) {
            return defaultDecision(request, signals, baseline, snapshot.version());
        }

        Decision decision = resolver.resolve(candidates, signals, baseline, request, snapshot.version());

        if (decision.isAccepted()) {
            log.info("Authentication ACCEPT: tenant={}, policy={}, tier={}",
                    request.tenantId(), decision.appliedPolicyId(), decision.riskTier());
        } else {
            log.warn("Authentication {}: tenant={}, policy={}, tier={}",
                    decision.verdict(), request.tenantId(), decision.appliedPolicyId(), decision.riskTier());
        }
        return decision;
    }

    private Decision defaultDecision(EvaluationRequest request, AggregatedSignals signals, RiskAssessment baseline,
                                     long version) {
        boolean allow = noPolicyBehavior == NoPolicyBehavior.ALLOW;
        List<String> reasons = new ArrayList<>(signals.warnings());
        reasons.add(String.format("no enabled policy applies to tenant %s; default %s",
                request.tenantId(), allow ? "allow" : "deny"));
        log.warn("No policy matched for tenant={}, userType={}, profile={}, region={}: {}",
                request.tenantId(), request.userType(), request.securityProfile(), request.region(),
                allow ? DEFAULT_ALLOW : DEFAULT_DENY);

        return Decision.builder()
                .verdict(allow ? Verdict.ACCEPT : Verdict.REJECT)
                .riskTier(baseline.tier())
                .riskScore(baseline.score())
                .appliedPolicyId(allow ? DEFAULT_ALLOW : DEFAULT_DENY)
                .reasons(reasons)
                .evaluatedAt(request.now())
                .registryVersion(version)
                .build();
    }
}
