package com.example.authpolicy.policy.exception;

/**
 * Admin lookup of a policy id that is not in the registry.
 */
public class PolicyNotFoundException extends PolicyEngineException {

    public PolicyNotFoundException(String message) {
        super("PolicyNotFoundError", message);
    }

    public static PolicyNotFoundException forId(String policyId) {
        return new PolicyNotFoundException("Policy not found: " + policyId);
    }
}
