package com.example.authpolicy.util;

import com.example.authpolicy.policy.document.PolicyDocument;
import com.example.authpolicy.policy.document.PolicyDocument.ActionDocument;
import com.example.authpolicy.policy.document.PolicyDocument.EmergencyAccessDocument;
import com.example.authpolicy.policy.document.PolicyDocument.ExemptionsDocument;
import com.example.authpolicy.policy.document.PolicyDocument.RulesDocument;
import com.example.authpolicy.policy.document.PolicyDocument.ThresholdsDocument;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Test builder for PolicyDocument. Defaults to a valid 2-factor MFA document.
 */
public class PolicyDocumentTestBuilder {

    private String id = "mfa-base";
    private String tenantId = EngineTestFixtures.TENANT;
    private String name = "Base MFA";
    private String type = "MFA";
    private Integer priority;
    private Boolean enabled;

    private Integer requiredFactors = 2;
    private Set<String> allowedMethods = PolicyTestBuilder.MFA_METHODS;
    private String minimumFactorStrength = "INTERMEDIATE";
    private Set<String> mandatoryFactorCategories;
    private Set<String> highRiskOperations;
    private Duration maxLastFactorAge;
    private Map<String, Double> riskFactors;
    private ThresholdsDocument riskThresholds;
    private Map<String, ActionDocument> actions;
    private Map<String, ActionDocument> riskLevels;
    private ActionDocument baseRequirements;
    private Map<String, ActionDocument> contextRules;
    private ExemptionsDocument exemptions;
    private EmergencyAccessDocument emergencyAccess;
    private Set<String> appliesToUserTypes;
    private boolean withoutRules;

    public static PolicyDocumentTestBuilder aDocument() {
        return new PolicyDocumentTestBuilder();
    }

    public static PolicyDocumentTestBuilder aStepUpDocument() {
        return aDocument()
                .withId("step-up")
                .withType("STEP_UP")
                .withAllowedMethods(PolicyTestBuilder.STRONG_METHODS)
                .withHighRiskOperations("transaction_approval")
                .withMaxLastFactorAge(Duration.ofMinutes(5));
    }

    public static PolicyDocumentTestBuilder anAdaptiveDocument() {
        Map<String, ActionDocument> actions = new LinkedHashMap<>();
        actions.put("low", action(1, Set.of("KB-01-01", "KB-01-02"), "BASIC"));
        actions.put("medium", action(2, PolicyTestBuilder.MFA_METHODS, "BASIC"));
        actions.put("high", action(2, PolicyTestBuilder.STRONG_METHODS, "ADVANCED"));
        return aDocument()
                .withId("adaptive")
                .withType("ADAPTIVE")
                .withRequiredFactors(null)
                .withAllowedMethods(null)
                .withMinimumFactorStrength(null)
                .withRiskFactors(Map.of("new_device", 40.0, "impossible_travel", 70.0))
                .withRiskThresholds(30.0, 60.0, 80.0)
                .withActions(actions);
    }

    public static ActionDocument action(Integer requiredFactors, Set<String> allowedMethods, String strength) {
        return new ActionDocument(requiredFactors, allowedMethods, strength, null, null);
    }

    public PolicyDocumentTestBuilder withId(String id) {
        this.id = id;
        return this;
    }

    public PolicyDocumentTestBuilder withTenantId(String tenantId) {
        this.tenantId = tenantId;
        return this;
    }

    public PolicyDocumentTestBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public PolicyDocumentTestBuilder withType(String type) {
        this.type = type;
        return this;
    }

    public PolicyDocumentTestBuilder withPriority(Integer priority) {
        this.priority = priority;
        return this;
    }

    public PolicyDocumentTestBuilder withEnabled(Boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public PolicyDocumentTestBuilder withRequiredFactors(Integer requiredFactors) {
        this.requiredFactors = requiredFactors;
        return this;
    }

    public PolicyDocumentTestBuilder withAllowedMethods(Set<String> allowedMethods) {
        this.allowedMethods = allowedMethods;
        return this;
    }

    public PolicyDocumentTestBuilder withMinimumFactorStrength(String minimumFactorStrength) {
        this.minimumFactorStrength = minimumFactorStrength;
        return this;
    }

    public PolicyDocumentTestBuilder withMandatoryFactorCategories(String... categories) {
        this.mandatoryFactorCategories = Set.of(categories);
        return this;
    }

    public PolicyDocumentTestBuilder withHighRiskOperations(String... operations) {
        this.highRiskOperations = Set.of(operations);
        return this;
    }

    public PolicyDocumentTestBuilder withMaxLastFactorAge(Duration maxLastFactorAge) {
        this.maxLastFactorAge = maxLastFactorAge;
        return this;
    }

    public PolicyDocumentTestBuilder withRiskFactors(Map<String, Double> riskFactors) {
        this.riskFactors = riskFactors;
        return this;
    }

    public PolicyDocumentTestBuilder withRiskThresholds(Double low, Double medium, Double high) {
        this.riskThresholds = new ThresholdsDocument(low, medium, high);
        return this;
    }

    public PolicyDocumentTestBuilder withActions(Map<String, ActionDocument> actions) {
        this.actions = actions;
        return this;
    }

    public PolicyDocumentTestBuilder withRiskLevels(Map<String, ActionDocument> riskLevels) {
        this.riskLevels = riskLevels;
        return this;
    }

    public PolicyDocumentTestBuilder withBaseRequirements(ActionDocument baseRequirements) {
        this.baseRequirements = baseRequirements;
        return this;
    }

    public PolicyDocumentTestBuilder withContextRules(Map<String, ActionDocument> contextRules) {
        this.contextRules = contextRules;
        return this;
    }

    public PolicyDocumentTestBuilder withExemptions(ExemptionsDocument exemptions) {
        this.exemptions = exemptions;
        return this;
    }

    public PolicyDocumentTestBuilder withEmergencyAccess(EmergencyAccessDocument emergencyAccess) {
        this.emergencyAccess = emergencyAccess;
        return this;
    }

    public PolicyDocumentTestBuilder withAppliesToUserTypes(Set<String> appliesToUserTypes) {
        this.appliesToUserTypes = appliesToUserTypes;
        return this;
    }

    public PolicyDocumentTestBuilder withoutRules() {
        this.withoutRules = true;
        return this;
    }

    public PolicyDocument build() {
        RulesDocument rules = withoutRules ? null : new RulesDocument(
                requiredFactors,
                allowedMethods,
                minimumFactorStrength,
                mandatoryFactorCategories,
                null,
                highRiskOperations,
                maxLastFactorAge,
                null,
                riskFactors,
                riskThresholds,
                actions,
                riskLevels,
                baseRequirements,
                contextRules,
                exemptions,
                emergencyAccess);
        return new PolicyDocument(id, tenantId, name, null, type, rules, appliesToUserTypes, null, null, enabled,
                priority);
    }
}
