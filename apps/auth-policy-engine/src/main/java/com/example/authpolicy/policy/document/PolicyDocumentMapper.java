package com.example.authpolicy.policy.document;

import com.example.authpolicy.policy.document.PolicyDocument.ActionDocument;
import com.example.authpolicy.policy.document.PolicyDocument.EmergencyAccessDocument;
import com.example.authpolicy.policy.document.PolicyDocument.ExemptionsDocument;
import com.example.authpolicy.policy.document.PolicyDocument.LowValuePaymentDocument;
import com.example.authpolicy.policy.document.PolicyDocument.RulesDocument;
import com.example.authpolicy.policy.document.PolicyDocument.ThresholdsDocument;
import com.example.authpolicy.policy.document.PolicyDocument.TransactionRiskAnalysisDocument;
import com.example.authpolicy.policy.document.PolicyDocument.TrustedBeneficiaryDocument;
import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.model.ActionSpec;
import com.example.authpolicy.policy.model.ActionSpecOverride;
import com.example.authpolicy.policy.model.AdaptiveRules;
import com.example.authpolicy.policy.model.ChannelKind;
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
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.policy.model.TypedRuleSet;
import com.example.authpolicy.policy.validation.ValidationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Converts between {@link PolicyDocument} and the typed {@link Policy} model.
 *
 * <p>{@link #read(PolicyDocument, List)} is lenient: it collects every missing or unparseable field
 * and leaves the affected section null. Semantic checks belong to the validator.
 */
@Component
public class PolicyDocumentMapper {

    private static final Map<PolicyType, Set<String>> RULE_FIELDS = Map.of(
            PolicyType.MFA, Set.of("required_factors", "allowed_methods", "minimum_factor_strength",
                    "mandatory_factor_categories", "max_session_duration"),
            PolicyType.STEP_UP, Set.of("required_factors", "allowed_methods", "minimum_factor_strength",
                    "mandatory_factor_categories", "max_session_duration",
                    "high_risk_operations", "max_last_factor_age", "require_fresh_authentication"),
            PolicyType.ADAPTIVE, Set.of("risk_factors", "risk_thresholds", "actions"),
            PolicyType.RISK_BASED, Set.of("risk_levels"),
            PolicyType.CONDITIONAL, Set.of("base_requirements", "context_rules", "exemptions", "emergency_access")
    );

    /**
     * Strict conversion for documents that already passed validation.
     *
     * @throws PolicyValidationException if the document cannot be converted
     */
    public Policy toPolicy(PolicyDocument document) {
        List<String> errors = new ArrayList<>();
        Policy policy = read(document, errors);
        if (!errors.isEmpty()) {
            throw new PolicyValidationException(document.id(), ValidationResult.of(errors));
        }
        return policy;
    }

    public Policy read(PolicyDocument document, List<String> errors) {
        requireText("id", document.id(), errors);
        requireText("tenant_id", document.tenantId(), errors);
        requireText("name", document.name(), errors);

        PolicyType type = null;
        if (document.type() == null || document.type().isBlank()) {
            errors.add("type is required");
        } else {
            type = PolicyType.fromValue(document.type()).orElse(null);
            if (type == null) {
                errors.add(ValidationResult.unknownPolicyType(document.type()).errors().get(0));
            }
        }

        TypedRuleSet rules = null;
        if (type != null) {
            if (document.rules() == null) {
                errors.add("rules is required");
            } else {
                rules = readRules(type, document.rules(), errors);
            }
        }

        return new Policy(
                document.id(),
                document.tenantId(),
                document.name(),
                document.description(),
                type,
                rules,
                readNames("applies_to_user_types", document.appliesToUserTypes(), errors),
                readNames("applies_to_security_profiles", document.appliesToSecurityProfiles(), errors),
                readNames("applies_to_regions", document.appliesToRegions(), errors),
                document.enabled() == null || document.enabled(),
                document.priority() == null ? Policy.DEFAULT_PRIORITY : document.priority()
        );
    }

    public PolicyDocument toDocument(Policy policy) {
        return new PolicyDocument(
                policy.id(),
                policy.tenantId(),
                policy.name(),
                policy.description(),
                policy.type() == null ? null : policy.type().name(),
                writeRules(policy.rules()),
                policy.appliesToUserTypes(),
                policy.appliesToSecurityProfiles(),
                policy.appliesToRegions(),
                policy.enabled(),
                policy.priority()
        );
    }

    // ----- reading -----

    private TypedRuleSet readRules(PolicyType type, RulesDocument rules, List<String> errors) {
        for (String field : presentFields(rules)) {
            if (!RULE_FIELDS.get(type).contains(field)) {
                errors.add(String.format("rules.%s is not a valid field for %s policies", field, type));
            }
        }

        return switch (type) {
            case MFA -> new MfaRules(readAction("rules", inline(rules), errors));
            case STEP_UP -> {
                ActionSpec requirements = readAction("rules", inline(rules), errors);
                if (rules.highRiskOperations() == null || rules.highRiskOperations().isEmpty()) {
                    errors.add("rules.high_risk_operations is required");
                }
                if (rules.maxLastFactorAge() == null) {
                    errors.add("rules.max_last_factor_age is required");
                }
                yield new StepUpRules(requirements,
                        readNames("rules.high_risk_operations", rules.highRiskOperations(), errors),
                        rules.maxLastFactorAge(),
                        rules.requireFreshAuthentication() == null || rules.requireFreshAuthentication());
            }
            case ADAPTIVE -> {
                if (rules.riskFactors() == null || rules.riskFactors().isEmpty()) {
                    errors.add("rules.risk_factors is required");
                }
                yield new AdaptiveRules(
                        readWeights(rules.riskFactors(), errors),
                        readThresholds("rules.risk_thresholds", rules.riskThresholds(), errors),
                        readTierActions("rules.actions", rules.actions(), errors));
            }
            case RISK_BASED -> new RiskBasedRules(readTierActions("rules.risk_levels", rules.riskLevels(), errors));
            case CONDITIONAL -> new ConditionalRules(
                    readAction("rules.base_requirements", rules.baseRequirements(), errors),
                    readContextRules(rules.contextRules(), errors),
                    readExemptions(rules.exemptions(), errors),
                    readEmergencyAccess(rules.emergencyAccess(), errors));
        };
    }

    private ActionSpec readAction(String path, ActionDocument action, List<String> errors) {
        if (action == null) {
            errors.add(path + " is required");
            return null;
        }
        int before = errors.size();
        if (action.requiredFactors() == null) {
            errors.add(path + ".required_factors is required");
        }
        if (action.allowedMethods() == null || action.allowedMethods().isEmpty()) {
            errors.add(path + ".allowed_methods is required");
        }
        Set<String> methods = readNames(path + ".allowed_methods", action.allowedMethods(), errors);
        StrengthTier strength = readStrength(path, action.minimumFactorStrength(), errors);
        Set<FactorKind> mandatory = readKinds(path, action.mandatoryFactorCategories(), errors);
        if (errors.size() > before) {
            return null;
        }
        return new ActionSpec(action.requiredFactors(), methods, strength, mandatory, action.maxSessionDuration());
    }

    private ActionSpecOverride readOverride(String path, ActionDocument action, List<String> errors) {
        if (action == null) {
            errors.add(path + " is required");
            return null;
        }
        int before = errors.size();
        Set<String> methods = readNames(path + ".allowed_methods", action.allowedMethods(), errors);
        StrengthTier strength = readStrength(path, action.minimumFactorStrength(), errors);
        Set<FactorKind> mandatory = action.mandatoryFactorCategories() == null
                ? null
                : readKinds(path, action.mandatoryFactorCategories(), errors);
        if (errors.size() > before) {
            return null;
        }
        return new ActionSpecOverride(action.requiredFactors(), methods, strength, mandatory,
                action.maxSessionDuration());
    }

    private Map<String, ActionSpecOverride> readContextRules(Map<String, ActionDocument> contextRules,
                                                             List<String> errors) {
        Map<String, ActionSpecOverride> overrides = new LinkedHashMap<>();
        if (contextRules == null) {
            return overrides;
        }
        contextRules.forEach((key, action) -> {
            if (key == null || key.isBlank()) {
                errors.add("rules.context_rules must not contain empty context keys");
                return;
            }
            ActionSpecOverride override = readOverride("rules.context_rules." + key, action, errors);
            if (override != null) {
                overrides.put(key, override);
            }
        });
        return overrides;
    }

    private RiskThresholds readThresholds(String path, ThresholdsDocument thresholds, List<String> errors) {
        if (thresholds == null) {
            errors.add(path + " is required");
            return null;
        }
        int before = errors.size();
        if (thresholds.low() == null) errors.add(path + ".low is required");
        if (thresholds.medium() == null) errors.add(path + ".medium is required");
        if (thresholds.high() == null) errors.add(path + ".high is required");
        if (errors.size() > before) {
            return null;
        }
        return new RiskThresholds(thresholds.low(), thresholds.medium(), thresholds.high());
    }

    private Map<RiskTier, ActionSpec> readTierActions(String path, Map<String, ActionDocument> actions,
                                                      List<String> errors) {
        Map<RiskTier, ActionSpec> byTier = new EnumMap<>(RiskTier.class);
        if (actions == null || actions.isEmpty()) {
            errors.add(path + " is required");
            return byTier;
        }
        actions.forEach((key, action) -> {
            RiskTier tier = RiskTier.fromValue(key).orElse(null);
            if (tier == null) {
                errors.add(String.format("%s: unknown risk tier '%s'", path, key));
                return;
            }
            ActionSpec spec = readAction(path + "." + key.toLowerCase(Locale.ROOT), action, errors);
            if (spec != null) {
                byTier.put(tier, spec);
            }
        });
        return byTier;
    }

    private List<ExemptionRule> readExemptions(ExemptionsDocument exemptions, List<String> errors) {
        List<ExemptionRule> rules = new ArrayList<>();
        if (exemptions == null) {
            return rules;
        }
        LowValuePaymentDocument lowValue = exemptions.lowValuePayment();
        if (lowValue != null) {
            if (lowValue.thresholdAmount() == null) {
                errors.add("rules.exemptions.low_value_payment.threshold_amount is required");
            } else {
                rules.add(new ExemptionRule.LowValuePayment(lowValue.thresholdAmount(), lowValue.cumulativeLimit(),
                        lowValue.consecutiveTransactions()));
            }
        }
        TrustedBeneficiaryDocument trusted = exemptions.trustedBeneficiary();
        if (trusted != null) {
            if (trusted.trustPeriod() == null) {
                errors.add("rules.exemptions.trusted_beneficiary.trust_period is required");
            } else {
                rules.add(new ExemptionRule.TrustedBeneficiary(trusted.trustPeriod()));
            }
        }
        TransactionRiskAnalysisDocument tra = exemptions.transactionRiskAnalysis();
        if (tra != null) {
            int before = errors.size();
            if (tra.fraudRateThreshold() == null) {
                errors.add("rules.exemptions.transaction_risk_analysis.fraud_rate_threshold is required");
            }
            Map<ChannelKind, BigDecimal> thresholds = new EnumMap<>(ChannelKind.class);
            if (tra.amountThresholds() == null || tra.amountThresholds().isEmpty()) {
                errors.add("rules.exemptions.transaction_risk_analysis.amount_thresholds is required");
            } else {
                tra.amountThresholds().forEach((channel, amount) -> ChannelKind.fromValue(channel).ifPresentOrElse(
                        kind -> {
                            if (amount == null) {
                                errors.add(String.format(
                                        "rules.exemptions.transaction_risk_analysis.amount_thresholds.%s is required",
                                        channel));
                            } else {
                                thresholds.put(kind, amount);
                            }
                        },
                        () -> errors.add(String.format(
                                "rules.exemptions.transaction_risk_analysis.amount_thresholds: unknown channel '%s'",
                                channel))));
            }
            if (errors.size() == before) {
                rules.add(new ExemptionRule.TransactionRiskAnalysis(tra.fraudRateThreshold(), thresholds));
            }
        }
        return rules;
    }

    private static EmergencyAccess readEmergencyAccess(EmergencyAccessDocument emergency, List<String> errors) {
        if (emergency == null) {
            return null;
        }
        boolean enabled = Boolean.TRUE.equals(emergency.enabled());
        Integer minutes = emergency.limitedAccessMinutes();
        if (enabled && minutes == null) {
            errors.add("rules.emergency_access.limited_access_minutes is required");
            return null;
        }
        return new EmergencyAccess(
                enabled,
                emergency.requiresAttestation() == null || emergency.requiresAttestation(),
                minutes == null ? null : Duration.ofMinutes(minutes),
                Boolean.TRUE.equals(emergency.requiresPostAttestation()));
    }

    /**
     * Copy of {@code values} without null or blank entries, each of which is reported.
     */
    private static Set<String> readNames(String path, Set<String> values, List<String> errors) {
        if (values == null) {
            return null;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                errors.add(path + " must not contain empty entries");
            } else {
                names.add(value);
            }
        }
        return names;
    }

    private static Map<String, Double> readWeights(Map<String, Double> riskFactors, List<String> errors) {
        if (riskFactors == null) {
            return null;
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        riskFactors.forEach((signal, weight) -> {
            if (signal == null || signal.isBlank()) {
                errors.add("rules.risk_factors must not contain empty signal names");
            } else if (weight == null) {
                errors.add(String.format("rules.risk_factors.%s must be a non-negative weight", signal));
            } else {
                weights.put(signal, weight);
            }
        });
        return weights;
    }

    private static StrengthTier readStrength(String path, String value, List<String> errors) {
        if (value == null) {
            return StrengthTier.BASIC;
        }
        return StrengthTier.fromValue(value).orElseGet(() -> {
            errors.add(String.format("%s.minimum_factor_strength: unknown strength tier '%s'", path, value));
            return null;
        });
    }

    private static Set<FactorKind> readKinds(String path, Set<String> values, List<String> errors) {
        Set<FactorKind> kinds = EnumSet.noneOf(FactorKind.class);
        if (values == null) {
            return kinds;
        }
        for (String value : values) {
            FactorKind.fromValue(value).ifPresentOrElse(kinds::add, () -> errors.add(String.format(
                    "%s.mandatory_factor_categories: unknown factor kind '%s'", path, value)));
        }
        return kinds;
    }

    private static void requireText(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " is required");
        }
    }

    private static ActionDocument inline(RulesDocument rules) {
        return new ActionDocument(rules.requiredFactors(), rules.allowedMethods(), rules.minimumFactorStrength(),
                rules.mandatoryFactorCategories(), rules.maxSessionDuration());
    }

    private static Set<String> presentFields(RulesDocument rules) {
        Set<String> present = new LinkedHashSet<>();
        if (rules.requiredFactors() != null) present.add("required_factors");
        if (rules.allowedMethods() != null) present.add("allowed_methods");
        if (rules.minimumFactorStrength() != null) present.add("minimum_factor_strength");
        if (rules.mandatoryFactorCategories() != null) present.add("mandatory_factor_categories");
        if (rules.maxSessionDuration() != null) present.add("max_session_duration");
        if (rules.highRiskOperations() != null) present.add("high_risk_operations");
        if (rules.maxLastFactorAge() != null) present.add("max_last_factor_age");
        if (rules.requireFreshAuthentication() != null) present.add("require_fresh_authentication");
        if (rules.riskFactors() != null) present.add("risk_factors");
        if (rules.riskThresholds() != null) present.add("risk_thresholds");
        if (rules.actions() != null) present.add("actions");
        if (rules.riskLevels() != null) present.add("risk_levels");
        if (rules.baseRequirements() != null) present.add("base_requirements");
        if (rules.contextRules() != null) present.add("context_rules");
        if (rules.exemptions() != null) present.add("exemptions");
        if (rules.emergencyAccess() != null) present.add("emergency_access");
        return present;
    }

    // ----- writing -----

    private static RulesDocument writeRules(TypedRuleSet rules) {
        if (rules instanceof MfaRules mfa) {
            ActionDocument a = writeAction(mfa.requirements());
            return new RulesDocument(a.requiredFactors(), a.allowedMethods(), a.minimumFactorStrength(),
                    a.mandatoryFactorCategories(), a.maxSessionDuration(),
                    null, null, null, null, null, null, null, null, null, null, null);
        }
        if (rules instanceof StepUpRules stepUp) {
            ActionDocument a = writeAction(stepUp.requirements());
            return new RulesDocument(a.requiredFactors(), a.allowedMethods(), a.minimumFactorStrength(),
                    a.mandatoryFactorCategories(), a.maxSessionDuration(),
                    stepUp.highRiskOperations(), stepUp.maxLastFactorAge(), stepUp.requireFreshAuthentication(),
                    null, null, null, null, null, null, null, null);
        }
        if (rules instanceof AdaptiveRules adaptive) {
            RiskThresholds t = adaptive.riskThresholds();
            return new RulesDocument(null, null, null, null, null, null, null, null,
                    new TreeMap<>(adaptive.riskFactors()),
                    t == null ? null : new ThresholdsDocument(t.low(), t.medium(), t.high()),
                    writeTierActions(adaptive.actions()),
                    null, null, null, null, null);
        }
        if (rules instanceof RiskBasedRules riskBased) {
            return new RulesDocument(null, null, null, null, null, null, null, null, null, null, null,
                    writeTierActions(riskBased.riskLevels()), null, null, null, null);
        }
        if (rules instanceof ConditionalRules conditional) {
            Map<String, ActionDocument> contextRules = new TreeMap<>();
            conditional.contextRules().forEach((key, override) -> contextRules.put(key, new ActionDocument(
                    override.requiredFactors(),
                    override.allowedMethods(),
                    override.minimumFactorStrength() == null ? null : override.minimumFactorStrength().name(),
                    names(override.mandatoryFactorCategories()),
                    override.maxSessionDuration())));
            return new RulesDocument(null, null, null, null, null, null, null, null, null, null, null, null,
                    writeAction(conditional.baseRequirements()), contextRules,
                    writeExemptions(conditional.exemptions()),
                    writeEmergencyAccess(conditional.emergencyAccess()));
        }
        return null;
    }

    private static ActionDocument writeAction(ActionSpec spec) {
        if (spec == null) {
            return new ActionDocument(null, null, null, null, null);
        }
        return new ActionDocument(spec.requiredFactors(), spec.allowedMethods(), spec.minimumFactorStrength().name(),
                names(spec.mandatoryFactorCategories()), spec.maxSessionDuration());
    }

    private static Map<String, ActionDocument> writeTierActions(Map<RiskTier, ActionSpec> actions) {
        Map<RiskTier, ActionSpec> ordered = new EnumMap<>(RiskTier.class);
        ordered.putAll(actions);
        Map<String, ActionDocument> documents = new LinkedHashMap<>();
        ordered.forEach((tier, spec) -> documents.put(tier.name().toLowerCase(Locale.ROOT), writeAction(spec)));
        return documents;
    }

    private static ExemptionsDocument writeExemptions(List<ExemptionRule> exemptions) {
        LowValuePaymentDocument lowValue = null;
        TrustedBeneficiaryDocument trusted = null;
        TransactionRiskAnalysisDocument tra = null;
        for (ExemptionRule exemption : exemptions) {
            if (exemption instanceof ExemptionRule.LowValuePayment lvp) {
                lowValue = new LowValuePaymentDocument(lvp.thresholdAmount(), lvp.cumulativeLimit(),
                        lvp.consecutiveTxLimit());
            } else if (exemption instanceof ExemptionRule.TrustedBeneficiary tb) {
                trusted = new TrustedBeneficiaryDocument(tb.trustPeriod());
            } else if (exemption instanceof ExemptionRule.TransactionRiskAnalysis analysis) {
                Map<String, BigDecimal> thresholds = new TreeMap<>();
                analysis.amountThresholds().forEach((channel, amount) -> thresholds.put(channel.name(), amount));
                tra = new TransactionRiskAnalysisDocument(analysis.fraudRateThreshold(), thresholds);
            }
        }
        return new ExemptionsDocument(lowValue, trusted, tra);
    }

    private static EmergencyAccessDocument writeEmergencyAccess(EmergencyAccess emergency) {
        if (emergency == null) {
            return null;
        }
        return new EmergencyAccessDocument(
                emergency.enabled(),
                emergency.requiresAttestation(),
                emergency.limitedAccess() == null ? null : Math.toIntExact(emergency.limitedAccess().toMinutes()),
                emergency.requiresPostAttestation());
    }

    private static Set<String> names(Set<FactorKind> kinds) {
        if (kinds == null) {
            return null;
        }
        Set<String> names = new LinkedHashSet<>();
        kinds.stream().sorted().forEach(kind -> names.add(kind.name()));
        return names;
    }
}
