package com.example.authpolicy.policy.dto;

import java.util.List;

/**
 * Result of storing a policy.
 *
 * @param registryVersion version of the snapshot that contains the policy
 */
public record PolicyWriteResponse(String policyId, boolean ok, List<String> errors, long registryVersion) {
}
