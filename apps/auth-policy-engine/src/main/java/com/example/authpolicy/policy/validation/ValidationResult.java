package com.example.authpolicy.policy.validation;

import java.util.List;

/**
 * Outcome of validating a policy. All errors found are reported together.
 *
 * @param ok     true when no error was found
 * @param errors human-readable errors in discovery order
 */
public record ValidationResult(boolean ok, List<String> errors) {

    public static final String UNKNOWN_POLICY_TYPE = "UnknownPolicyTypeError";

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors);
    }

    /**
     * An unknown type makes every other check meaningless, so it is the only error reported.
     */
    public static ValidationResult unknownPolicyType(String type) {
        return new ValidationResult(false,
                List.of(String.format("%s: unknown policy type '%s'", UNKNOWN_POLICY_TYPE, type)));
    }

    public boolean isUnknownPolicyType() {
        return errors.size() == 1 && errors.get(0).startsWith(UNKNOWN_POLICY_TYPE);
    }
}
