package com.example.authpolicy.policy.model;

import java.util.List;
import java.util.Map;

/**
 * Conditional rules: base requirements, per-context overrides and exemptions that may waive factors.
 *
 * @param emergencyAccess optional break-glass block, null when the policy has none
 */
public record ConditionalRules(
        ActionSpec baseRequirements,
        Map<String, ActionSpecOverride> contextRules,
        List<ExemptionRule> exemptions,
        EmergencyAccess emergencyAccess
) implements TypedRuleSet {

    public ConditionalRules {
        contextRules = contextRules == null ? Map.of() : Map.copyOf(contextRules);
        exemptions = exemptions == null ? List.of() : List.copyOf(exemptions);
    }

    public ConditionalRules(ActionSpec baseRequirements, Map<String, ActionSpecOverride> contextRules,
                            List<ExemptionRule> exemptions) {
        this(baseRequirements, contextRules, exemptions, null);
    }

    @Override
    public PolicyType type() {
        return PolicyType.CONDITIONAL;
    }
}
