package com.example.authpolicy.registry;

import com.example.authpolicy.policy.model.Policy;

import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped store of authentication policies.
 *
 * <p>Writers publish a new {@link PolicySnapshot}; readers never observe a half-applied update.
 */
public interface PolicyRegistry {

    /**
     * Current snapshot. Callers evaluating a request must keep using the same instance.
     */
    PolicySnapshot snapshot();

    /**
     * Validate and insert or replace a policy.
     *
     * @throws com.example.authpolicy.policy.exception.PolicyValidationException if the policy is invalid
     */
    PolicySnapshot put(Policy policy);

    /**
     * @return true if a policy was removed
     */
    boolean delete(String policyId);

    default Optional<Policy> get(String policyId) {
        return snapshot().get(policyId);
    }

    default List<Policy> list(PolicyFilter filter) {
        return snapshot().list(filter);
    }
}
