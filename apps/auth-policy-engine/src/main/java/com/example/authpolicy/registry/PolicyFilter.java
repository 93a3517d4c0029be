package com.example.authpolicy.registry;

import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyType;

/**
 * Admin listing filter. Null fields do not filter.
 */
public record PolicyFilter(String tenantId, PolicyType type, Boolean enabled) {

    public static PolicyFilter all() {
        return new PolicyFilter(null, null, null);
    }

    public boolean matches(Policy policy) {
        return (tenantId == null || tenantId.equals(policy.tenantId()))
                && (type == null || type == policy.type())
                && (enabled == null || enabled == policy.enabled());
    }
}
