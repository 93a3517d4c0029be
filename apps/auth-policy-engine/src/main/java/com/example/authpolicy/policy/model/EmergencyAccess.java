package com.example.authpolicy.policy.model;

import java.time.Duration;

/**
 * Break-glass access for a conditional policy. Requested through the {@value #CONTEXT_KEY} context key;
 * while active, context rules do not escalate the base requirements and the session is capped
 * at {@code limitedAccess}.
 *
 * @param requiresAttestation     the request must carry an attestation reference
 * @param limitedAccess           session cap for emergency decisions
 * @param requiresPostAttestation the access must be attested again after the fact
 */
public record EmergencyAccess(
        boolean enabled,
        boolean requiresAttestation,
        Duration limitedAccess,
        boolean requiresPostAttestation
) {
    public static final String CONTEXT_KEY = "emergency_access";
}
