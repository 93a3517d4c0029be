package com.example.authpolicy.policy.model;

import java.util.Set;

/**
 * Authentication policy definition.
 *
 * <p>Lower {@code priority} means higher precedence. Between equal priorities the policy with
 * more non-wildcard {@code appliesTo*} scopes wins, see {@link #specificity()}.
 */
public record Policy(
        String id,
        String tenantId,
        String name,
        String description,
        PolicyType type,
        TypedRuleSet rules,
        Set<String> appliesToUserTypes,
        Set<String> appliesToSecurityProfiles,
        Set<String> appliesToRegions,
        boolean enabled,
        int priority
) {
    public static final int DEFAULT_PRIORITY = 100;

    public Policy {
        appliesToUserTypes = appliesToUserTypes == null ? Set.of() : Set.copyOf(appliesToUserTypes);
        appliesToSecurityProfiles = appliesToSecurityProfiles == null ? Set.of() : Set.copyOf(appliesToSecurityProfiles);
        appliesToRegions = appliesToRegions == null ? Set.of() : Set.copyOf(appliesToRegions);
    }

    /**
     * Number of scopes narrowed to explicit values. Empty scopes are wildcards.
     */
    public int specificity() {
        int specificity = 0;
        if (!appliesToUserTypes.isEmpty()) specificity++;
        if (!appliesToSecurityProfiles.isEmpty()) specificity++;
        if (!appliesToRegions.isEmpty()) specificity++;
        return specificity;
    }

    /**
     * Check if this policy is in scope for the given query. Disabled policies never apply.
     */
    public boolean appliesTo(PolicyQuery query) {
        return enabled
                && tenantId != null && tenantId.equals(query.tenantId())
                && inScope(appliesToUserTypes, query.userType())
                && inScope(appliesToSecurityProfiles, query.securityProfile())
                && inScope(appliesToRegions, query.region());
    }

    /**
     * Typed access to the rule set. Callers switch on {@link #type()} first.
     */
    public <T extends TypedRuleSet> T rules(Class<T> rulesType) {
        return rulesType.cast(rules);
    }

    private static boolean inScope(Set<String> scope, String value) {
        if (scope.isEmpty()) {
            return true;
        }
        return value != null && scope.stream().anyMatch(value::equalsIgnoreCase);
    }
}
