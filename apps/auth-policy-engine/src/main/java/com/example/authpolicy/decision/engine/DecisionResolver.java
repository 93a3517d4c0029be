package com.example.authpolicy.decision.engine;

import com.example.authpolicy.decision.model.Decision;
import com.example.authpolicy.decision.model.EvaluationRequest;
import com.example.authpolicy.decision.model.Verdict;
import com.example.authpolicy.policy.exception.AmbiguousPolicyException;
import com.example.authpolicy.policy.exception.IncompleteActionSpecException;
import com.example.authpolicy.policy.model.ActionSpec;
import com.example.authpolicy.policy.model.AdaptiveRules;
import com.example.authpolicy.policy.model.ConditionalRules;
import com.example.authpolicy.policy.model.EmergencyAccess;
import com.example.authpolicy.policy.model.ExemptionRule;
import com.example.authpolicy.policy.model.MfaRules;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.RiskBasedRules;
import com.example.authpolicy.policy.model.StepUpRules;
import com.example.authpolicy.policy.model.TieredRules;
import com.example.authpolicy.risk.RiskAssessment;
import com.example.authpolicy.risk.RiskContext;
import com.example.authpolicy.risk.RiskModel;
import com.example.authpolicy.risk.RiskScorer;
import com.example.authpolicy.signal.model.AggregatedSignals;
import com.example.authpolicy.signal.model.FactorEvidence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the highest-precedence candidate policy to aggregated evidence and risk.
 *
 * <p>Candidates arrive in precedence order. The first one is applied; another candidate with the same
 * type, priority and specificity makes the configuration ambiguous.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionResolver {

    private static final Comparator<ActionSpec> STRICTNESS = Comparator
            .comparingInt(ActionSpec::requiredFactors)
            .thenComparing(ActionSpec::minimumFactorStrength)
            .thenComparingInt(spec -> spec.mandatoryFactorCategories().size());

    private final FactorRequirementEvaluator requirementEvaluator;
    private final ExemptionEvaluator exemptionEvaluator;
    private final RiskScorer riskScorer;

    public Decision resolve(List<Policy> candidates, AggregatedSignals signals, RiskAssessment baseline,
                            EvaluationRequest request, long registryVersion) {
        Policy policy = selectPolicy(candidates, candidates.get(0).type());

        Resolution resolution = new Resolution(request, signals, baseline, registryVersion);
        resolution.reasons.addAll(signals.warnings());
        resolution.reasons.add(String.format("applying %s policy %s (priority %d)",
                policy.type(), policy.id(), policy.priority()));

        return switch (policy.type()) {
            case MFA -> resolveMfa(policy, policy.rules(MfaRules.class).requirements(), resolution);
            case STEP_UP -> resolveStepUp(policy, candidates, resolution);
            case ADAPTIVE -> {
                AdaptiveRules rules = policy.rules(AdaptiveRules.class);
                RiskAssessment assessment = riskScorer.assess(RiskModel.of(rules), request.riskContext());
                yield resolveTiered(policy, rules, assessment, resolution);
            }
            case RISK_BASED -> resolveTiered(policy, policy.rules(RiskBasedRules.class), baseline, resolution);
            case CONDITIONAL -> resolveConditional(policy, resolution);
        };
    }

    /**
     * First candidate of the given type, rejecting ties on priority and specificity.
     */
    private static Policy selectPolicy(List<Policy> candidates, PolicyType type) {
        List<Policy> ofType = candidates.stream().filter(policy -> policy.type() == type).toList();
        Policy top = ofType.get(0);
        List<String> tied = ofType.stream()
                .filter(policy -> policy.priority() == top.priority() && policy.specificity() == top.specificity())
                .map(Policy::id)
                .toList();
        if (tied.size() > 1) {
            log.error("Ambiguous {} policies for tenant {}: {}", type, top.tenantId(), tied);
            throw new AmbiguousPolicyException(tied);
        }
        return top;
    }

    private Decision resolveMfa(Policy policy, ActionSpec requirements, Resolution resolution) {
        RequirementOutcome outcome = requirementEvaluator.evaluate(requirements, resolution.signals.evidence());
        resolution.reasons.addAll(outcome.reasons());
        return resolution.decide(outcome.satisfied() ? Verdict.ACCEPT : Verdict.REJECT, policy, outcome,
                resolution.baseline, requirements, null);
    }

    private Decision resolveStepUp(Policy policy, List<Policy> candidates, Resolution resolution) {
        StepUpRules rules = policy.rules(StepUpRules.class);
        String operation = resolution.request.effectiveOperation();

        if (!rules.isHighRisk(operation)) {
            boolean hasMfa = candidates.stream().anyMatch(candidate -> candidate.type() == PolicyType.MFA);
            if (hasMfa) {
                Policy mfa = selectPolicy(candidates, PolicyType.MFA);
                resolution.reasons.add(String.format("operation %s is not high-risk; delegating to MFA policy %s",
                        operation, mfa.id()));
                return resolveMfa(mfa, mfa.rules(MfaRules.class).requirements(), resolution);
            }
            resolution.reasons.add(String.format(
                    "operation %s is not high-risk and no MFA policy applies; using step-up requirements without freshness",
                    operation));
            return resolveMfa(policy, rules.requirements(), resolution);
        }

        List<FactorEvidence> fresh = new ArrayList<>();
        List<FactorEvidence> expired = new ArrayList<>(resolution.signals.staleEvidence());
        for (FactorEvidence factor : resolution.signals.evidence()) {
            if (factor.isOlderThan(rules.maxLastFactorAge(), resolution.request.now())) {
                expired.add(factor);
                resolution.reasons.add(String.format("%s observed at %s is older than %s and treated as absent",
                        factor.label(), factor.observedAt(), rules.maxLastFactorAge()));
            } else {
                fresh.add(factor);
            }
        }

        RequirementOutcome outcome = requirementEvaluator.evaluate(rules.requirements(), fresh);
        resolution.reasons.add(String.format("operation %s is high-risk", operation));
        resolution.reasons.addAll(outcome.reasons());
        if (outcome.satisfied()) {
            return resolution.decide(Verdict.ACCEPT, policy, outcome, resolution.baseline, rules.requirements(), null);
        }

        Verdict verdict;
        if (rules.requireFreshAuthentication()) {
            verdict = Verdict.STEP_UP_REQUIRED;
            if (fresh.isEmpty()) {
                resolution.reasons.add(String.format("fresh authentication required: no factor observed within %s",
                        rules.maxLastFactorAge()));
            }
        } else {
            List<FactorEvidence> all = new ArrayList<>(fresh);
            all.addAll(expired);
            boolean freshnessOnly = requirementEvaluator.evaluate(rules.requirements(), all).satisfied();
            verdict = freshnessOnly ? Verdict.STEP_UP_REQUIRED : Verdict.REJECT;
        }
        return resolution.decide(verdict, policy, outcome, resolution.baseline, rules.requirements(), null);
    }

    private Decision resolveTiered(Policy policy, TieredRules rules, RiskAssessment assessment,
                                   Resolution resolution) {
        resolution.reasons.addAll(assessment.reasons());
        ActionSpec spec = rules.actionFor(assessment.tier())
                .orElseThrow(() -> new IncompleteActionSpecException(policy.id(), assessment.tier()));

        RequirementOutcome outcome = requirementEvaluator.evaluate(spec, resolution.signals.evidence());
        resolution.reasons.addAll(outcome.reasons());
        return resolution.decide(outcome.satisfied() ? Verdict.ACCEPT : Verdict.REJECT, policy, outcome,
                assessment, spec, null);
    }

    private Decision resolveConditional(Policy policy, Resolution resolution) {
        ConditionalRules rules = policy.rules(ConditionalRules.class);
        if (emergencyAccessGranted(policy, rules.emergencyAccess(), resolution)) {
            return resolveEmergency(policy, rules, resolution);
        }
        ActionSpec spec = rules.baseRequirements();

        Comparator<Map.Entry<String, ActionSpec>> byStrictness = Comparator
                .comparing((Map.Entry<String, ActionSpec> entry) -> entry.getValue(), STRICTNESS)
                .thenComparing(Map.Entry::getKey, Comparator.reverseOrder());
        Optional<Map.Entry<String, ActionSpec>> strictest = rules.contextRules().entrySet().stream()
                .filter(entry -> resolution.request.riskContext().contextKeys().contains(entry.getKey()))
                .map(entry -> Map.entry(entry.getKey(), entry.getValue().applyTo(rules.baseRequirements())))
                .max(byStrictness);
        if (strictest.isPresent()) {
            spec = strictest.get().getValue();
            resolution.reasons.add(String.format("context rule %s applied", strictest.get().getKey()));
        }

        Optional<ExemptionEvaluator.ExemptionCheck> exemption = exemptionEvaluator.firstMatch(
                rules.exemptions(), resolution.request.riskContext(), resolution.request.now(), resolution.reasons);
        if (exemption.isPresent()) {
            spec = spec.exempted();
        }

        RequirementOutcome outcome = requirementEvaluator.evaluate(spec, resolution.signals.evidence());
        resolution.reasons.addAll(outcome.reasons());
        return resolution.decide(outcome.satisfied() ? Verdict.ACCEPT : Verdict.REJECT, policy, outcome,
                resolution.baseline, spec, exemption.map(ExemptionEvaluator.ExemptionCheck::rule).orElse(null));
    }

    private static boolean emergencyAccessGranted(Policy policy, EmergencyAccess emergency, Resolution resolution) {
        RiskContext context = resolution.request.riskContext();
        if (!context.contextKeys().contains(EmergencyAccess.CONTEXT_KEY)) {
            return false;
        }
        if (emergency == null || !emergency.enabled()) {
            resolution.reasons.add(String.format("emergency access requested but not enabled by policy %s",
                    policy.id()));
            return false;
        }
        if (emergency.requiresAttestation() && !context.hasEmergencyAttestation()) {
            resolution.reasons.add("emergency access requested without attestation; regular rules apply");
            return false;
        }
        return true;
    }

    /**
     * Break-glass path: base requirements without context escalation or exemptions, session capped.
     */
    private Decision resolveEmergency(Policy policy, ConditionalRules rules, Resolution resolution) {
        EmergencyAccess emergency = rules.emergencyAccess();
        ActionSpec spec = rules.baseRequirements().withSessionCap(emergency.limitedAccess());
        String attestation = resolution.request.riskContext().hasEmergencyAttestation()
                ? resolution.request.riskContext().emergencyAttestation()
                : "none";
        log.warn("Emergency access requested under policy {} for tenant {}", policy.id(), policy.tenantId());
        resolution.reasons.add(String.format("emergency access under attestation %s; session limited to %s",
                attestation, spec.maxSessionDuration()));
        if (emergency.requiresPostAttestation()) {
            resolution.reasons.add("post-access attestation required");
        }

        RequirementOutcome outcome = requirementEvaluator.evaluate(spec, resolution.signals.evidence());
        resolution.reasons.addAll(outcome.reasons());
        return resolution.decide(outcome.satisfied() ? Verdict.ACCEPT : Verdict.REJECT, policy, outcome,
                resolution.baseline, spec, null);
    }

    /**
     * Per-evaluation state: the request, its aggregated inputs and the growing reason trail.
     */
    private static final class Resolution {
        private final EvaluationRequest request;
        private final AggregatedSignals signals;
        private final RiskAssessment baseline;
        private final long registryVersion;
        private final List<String> reasons = new ArrayList<>();

        private Resolution(EvaluationRequest request, AggregatedSignals signals, RiskAssessment baseline,
                           long registryVersion) {
            this.request = request;
            this.signals = signals;
            this.baseline = baseline;
            this.registryVersion = registryVersion;
        }

        private Decision decide(Verdict verdict, Policy policy, RequirementOutcome outcome, RiskAssessment risk,
                                ActionSpec spec, ExemptionRule exemption) {
            return Decision.builder()
                    .verdict(verdict)
                    .satisfiedFactors(outcome.satisfiedFactors())
                    .riskTier(risk.tier())
                    .riskScore(risk.score())
                    .appliedPolicyId(policy.id())
                    .appliedPolicyType(policy.type())
                    .appliedExemption(exemption)
                    .maxSessionDuration(verdict == Verdict.ACCEPT ? spec.maxSessionDuration() : null)
                    .reasons(reasons)
                    .evaluatedAt(request.now())
                    .registryVersion(registryVersion)
                    .build();
        }
    }
}
