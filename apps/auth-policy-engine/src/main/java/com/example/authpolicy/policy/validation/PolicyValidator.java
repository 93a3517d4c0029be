package com.example.authpolicy.policy.validation;

import com.example.authpolicy.policy.document.PolicyDocument;
import com.example.authpolicy.policy.document.PolicyDocumentMapper;
import com.example.authpolicy.policy.model.ActionSpec;
import com.example.authpolicy.policy.model.AdaptiveRules;
import com.example.authpolicy.policy.model.ConditionalRules;
import com.example.authpolicy.policy.model.EmergencyAccess;
import com.example.authpolicy.policy.model.ExemptionRule;
import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.MfaRules;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.RiskBasedRules;
import com.example.authpolicy.policy.model.RiskThresholds;
import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.policy.model.StepUpRules;
import com.example.authpolicy.signal.MethodCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks policy definitions before they reach the registry. Every error found is reported.
 *
 * <p>Documents are parsed leniently by {@link PolicyDocumentMapper} first; the typed checks then run
 * on whatever sections could be built.
 */
@Component
@RequiredArgsConstructor
public class PolicyValidator {

    private static final List<RiskTier> REQUIRED_TIERS = List.of(RiskTier.LOW, RiskTier.MEDIUM, RiskTier.HIGH);

    private final MethodCatalog methodCatalog;
    private final PolicyDocumentMapper mapper;

    public ValidationResult validate(PolicyDocument document) {
        if (document.type() != null && !document.type().isBlank()
                && PolicyType.fromValue(document.type()).isEmpty()) {
            return ValidationResult.unknownPolicyType(document.type());
        }
        List<String> errors = new ArrayList<>();
        Policy policy = mapper.read(document, errors);
        checkRules(policy, false, errors);
        return ValidationResult.of(new ArrayList<>(new LinkedHashSet<>(errors)));
    }

    public ValidationResult validate(Policy policy) {
        List<String> errors = new ArrayList<>();
        requireText("id", policy.id(), errors);
        requireText("tenant_id", policy.tenantId(), errors);
        requireText("name", policy.name(), errors);
        if (policy.type() == null) {
            errors.add("type is required");
        }
        if (policy.rules() == null) {
            errors.add("rules is required");
        } else if (policy.type() != null && policy.rules().type() != policy.type()) {
            errors.add(String.format("rules variant %s does not match declared type %s",
                    policy.rules().type(), policy.type()));
        }
        checkRules(policy, true, errors);
        return ValidationResult.of(errors);
    }

    /**
     * @param reportMissing false when missing sections were already reported while parsing
     */
    private void checkRules(Policy policy, boolean reportMissing, List<String> errors) {
        if (policy.type() == null || policy.rules() == null || policy.rules().type() != policy.type()) {
            return;
        }
        switch (policy.type()) {
            case MFA -> checkRequirements("rules", policy.rules(MfaRules.class).requirements(), 1,
                    reportMissing, errors);
            case STEP_UP -> checkStepUp(policy.rules(StepUpRules.class), reportMissing, errors);
            case ADAPTIVE -> checkAdaptive(policy.rules(AdaptiveRules.class), reportMissing, errors);
            case RISK_BASED -> checkTierActions("rules.risk_levels",
                    policy.rules(RiskBasedRules.class).riskLevels(), reportMissing, errors);
            case CONDITIONAL -> checkConditional(policy.rules(ConditionalRules.class), reportMissing, errors);
        }
    }

    private void checkStepUp(StepUpRules rules, boolean reportMissing, List<String> errors) {
        checkRequirements("rules", rules.requirements(), 1, reportMissing, errors);
        if (rules.highRiskOperations().isEmpty() && reportMissing) {
            errors.add("rules.high_risk_operations is required");
        }
        if (rules.maxLastFactorAge() == null) {
            if (reportMissing) {
                errors.add("rules.max_last_factor_age is required");
            }
        } else if (!isPositive(rules.maxLastFactorAge())) {
            errors.add("rules.max_last_factor_age must be positive");
        }
    }

    private void checkAdaptive(AdaptiveRules rules, boolean reportMissing, List<String> errors) {
        if (rules.riskFactors().isEmpty() && reportMissing) {
            errors.add("rules.risk_factors is required");
        }
        new TreeSet<>(rules.riskFactors().keySet()).forEach(signal -> {
            double weight = rules.riskFactors().get(signal);
            if (Double.isNaN(weight) || weight < 0) {
                errors.add(String.format("rules.risk_factors.%s must be a non-negative weight", signal));
            }
        });

        RiskThresholds thresholds = rules.riskThresholds();
        if (thresholds == null) {
            if (reportMissing) {
                errors.add("rules.risk_thresholds is required");
            }
        } else if (!thresholds.isStrictlyAscending()) {
            errors.add(String.format(
                    "rules.risk_thresholds must be strictly ascending (low < medium < high), got %s/%s/%s",
                    thresholds.low(), thresholds.medium(), thresholds.high()));
        } else if (thresholds.low() < 0) {
            errors.add("rules.risk_thresholds.low must not be negative");
        }

        checkTierActions("rules.actions", rules.actions(), reportMissing, errors);
    }

    private void checkTierActions(String path, Map<RiskTier, ActionSpec> actions, boolean reportMissing,
                                  List<String> errors) {
        if (actions.isEmpty()) {
            if (reportMissing) {
                errors.add(path + " is required");
            }
            return;
        }
        for (RiskTier tier : REQUIRED_TIERS) {
            if (!actions.containsKey(tier)) {
                errors.add(String.format("%s: no action for risk tier %s", path, tier));
            }
        }
        for (RiskTier tier : RiskTier.values()) {
            ActionSpec spec = actions.get(tier);
            if (spec != null) {
                checkRequirements(path + "." + tier.name().toLowerCase(), spec, 0, reportMissing, errors);
            }
        }
    }

    private void checkConditional(ConditionalRules rules, boolean reportMissing, List<String> errors) {
        ActionSpec base = rules.baseRequirements();
        checkRequirements("rules.base_requirements", base, 0, reportMissing, errors);
        if (base != null) {
            new TreeSet<>(rules.contextRules().keySet()).forEach(key -> checkRequirements(
                    "rules.context_rules." + key, rules.contextRules().get(key).applyTo(base), 0, reportMissing,
                    errors));
        }
        for (ExemptionRule exemption : rules.exemptions()) {
            checkExemption(exemption, errors);
        }
        EmergencyAccess emergency = rules.emergencyAccess();
        if (emergency != null && emergency.enabled()) {
            if (emergency.limitedAccess() == null) {
                errors.add("rules.emergency_access.limited_access_minutes is required");
            } else if (!isPositive(emergency.limitedAccess())) {
                errors.add("rules.emergency_access.limited_access_minutes must be positive");
            }
        }
    }

    private void checkExemption(ExemptionRule exemption, List<String> errors) {
        if (exemption instanceof ExemptionRule.LowValuePayment lowValue) {
            String path = "rules.exemptions.low_value_payment";
            if (lowValue.thresholdAmount() == null) {
                errors.add(path + ".threshold_amount is required");
            } else if (lowValue.thresholdAmount().signum() < 0) {
                errors.add(path + ".threshold_amount must not be negative");
            } else if (lowValue.cumulativeLimit() != null
                    && lowValue.cumulativeLimit().compareTo(lowValue.thresholdAmount()) < 0) {
                errors.add(path + ".cumulative_limit must not be lower than threshold_amount");
            }
            if (lowValue.consecutiveTxLimit() != null && lowValue.consecutiveTxLimit() < 1) {
                errors.add(path + ".consecutive_transactions must be >= 1");
            }
        } else if (exemption instanceof ExemptionRule.TrustedBeneficiary trusted) {
            if (trusted.trustPeriod() == null || !isPositive(trusted.trustPeriod())) {
                errors.add("rules.exemptions.trusted_beneficiary.trust_period must be positive");
            }
        } else if (exemption instanceof ExemptionRule.TransactionRiskAnalysis analysis) {
            String path = "rules.exemptions.transaction_risk_analysis";
            if (!(analysis.fraudRateThreshold() > 0 && analysis.fraudRateThreshold() <= 1)) {
                errors.add(path + ".fraud_rate_threshold must be within (0, 1]");
            }
            if (analysis.amountThresholds().isEmpty()) {
                errors.add(path + ".amount_thresholds must not be empty");
            }
            analysis.amountThresholds().forEach((channel, amount) -> {
                if (amount.compareTo(BigDecimal.ZERO) < 0) {
                    errors.add(String.format("%s.amount_thresholds.%s must not be negative", path, channel));
                }
            });
        }
    }

    private void checkRequirements(String path, ActionSpec spec, int minimumRequired, boolean reportMissing,
                                   List<String> errors) {
        if (spec == null) {
            if (reportMissing) {
                errors.add(path + " is required");
            }
            return;
        }
        if (spec.requiredFactors() < minimumRequired) {
            errors.add(String.format("%s.required_factors must be >= %d (was %d)",
                    path, minimumRequired, spec.requiredFactors()));
        }
        if (spec.allowedMethods().isEmpty()) {
            errors.add(path + ".allowed_methods must not be empty");
        }
        for (String method : new TreeSet<>(spec.allowedMethods())) {
            if (!methodCatalog.isKnown(method)) {
                errors.add(String.format("%s.allowed_methods: unknown method '%s'", path, method));
            }
        }

        Set<FactorKind> reachable = methodCatalog.kindsOf(spec.allowedMethods(), spec.minimumFactorStrength());
        if (spec.requiredFactors() > reachable.size()) {
            errors.add(String.format(
                    "%s.required_factors %d exceeds the %d distinct factor kinds reachable through allowed_methods at %s",
                    path, spec.requiredFactors(), reachable.size(), spec.minimumFactorStrength()));
        }

        Set<FactorKind> unreachable = EnumSet.noneOf(FactorKind.class);
        unreachable.addAll(spec.mandatoryFactorCategories());
        unreachable.removeAll(reachable);
        if (!unreachable.isEmpty()) {
            errors.add(String.format("%s.mandatory_factor_categories %s not reachable through allowed_methods",
                    path, unreachable));
        }
        if (spec.mandatoryFactorCategories().size() > spec.requiredFactors()) {
            errors.add(String.format("%s.mandatory_factor_categories names %d kinds but required_factors is %d",
                    path, spec.mandatoryFactorCategories().size(), spec.requiredFactors()));
        }
        if (spec.maxSessionDuration() != null && !isPositive(spec.maxSessionDuration())) {
            errors.add(path + ".max_session_duration must be positive");
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private static void requireText(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " is required");
        }
    }
}
