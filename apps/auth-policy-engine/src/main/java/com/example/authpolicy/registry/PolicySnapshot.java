package com.example.authpolicy.registry;

import com.example.authpolicy.policy.exception.NoApplicablePolicyException;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyQuery;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of the registry. An evaluation reads exactly one snapshot.
 */
public record PolicySnapshot(long version, Map<String, Policy> policies) {

    /**
     * Precedence order: lower priority first, then more specific scope, then id.
     */
    public static final Comparator<Policy> PRECEDENCE = Comparator
            .comparingInt(Policy::priority)
            .thenComparing(Comparator.comparingInt(Policy::specificity).reversed())
            .thenComparing(Policy::id);

    public PolicySnapshot {
        policies = Map.copyOf(policies);
    }

    public static PolicySnapshot empty() {
        return new PolicySnapshot(0L, Map.of());
    }

    public Optional<Policy> get(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public List<Policy> list(PolicyFilter filter) {
        return policies.values().stream()
                .filter(filter::matches)
                .sorted(PRECEDENCE)
                .toList();
    }

    /**
     * Enabled policies in scope for the query, in precedence order. May be empty.
     */
    public List<Policy> resolveCandidates(PolicyQuery query) {
        return policies.values().stream()
                .filter(policy -> policy.appliesTo(query))
                .sorted(PRECEDENCE)
                .toList();
    }

    /**
     * @throws NoApplicablePolicyException if no enabled policy is in scope
     */
    public List<Policy> requireCandidates(PolicyQuery query) {
        List<Policy> candidates = resolveCandidates(query);
        if (candidates.isEmpty()) {
            throw new NoApplicablePolicyException(query);
        }
        return candidates;
    }

    PolicySnapshot with(Policy policy) {
        Map<String, Policy> next = new HashMap<>(policies);
        next.put(policy.id(), policy);
        return new PolicySnapshot(version + 1, next);
    }

    PolicySnapshot without(String policyId) {
        Map<String, Policy> next = new HashMap<>(policies);
        next.remove(policyId);
        return new PolicySnapshot(version + 1, next);
    }
}
