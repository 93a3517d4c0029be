package com.example.authpolicy.policy.exception;

/**
 * Base type for engine misconfiguration and rejected policy writes.
 * Verdicts such as REJECT or STEP_UP_REQUIRED are outcomes and never surface as exceptions.
 */
public abstract class PolicyEngineException extends RuntimeException {

    private final String errorCode;

    protected PolicyEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
