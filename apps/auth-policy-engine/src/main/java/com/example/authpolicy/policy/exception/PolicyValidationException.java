package com.example.authpolicy.policy.exception;

import com.example.authpolicy.policy.validation.ValidationResult;

public class PolicyValidationException extends PolicyEngineException {

    private final String policyId;
    private final ValidationResult result;

    public PolicyValidationException(String policyId, ValidationResult result) {
        super("ValidationError", "Policy " + policyId + " is invalid: " + String.join("; ", result.errors()));
        this.policyId = policyId;
        this.result = result;
    }

    public String getPolicyId() {
        return policyId;
    }

    public ValidationResult getResult() {
        return result;
    }
}
