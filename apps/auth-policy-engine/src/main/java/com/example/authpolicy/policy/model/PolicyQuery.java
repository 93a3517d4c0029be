package com.example.authpolicy.policy.model;

/**
 * Lookup key for candidate policies.
 */
public record PolicyQuery(
        String tenantId,
        String userType,
        String securityProfile,
        String region
) {
}
