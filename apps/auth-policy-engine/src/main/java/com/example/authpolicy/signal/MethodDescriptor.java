package com.example.authpolicy.signal;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;

/**
 * Catalog entry for an authentication method. {@code nominalStrength} is null when the
 * method is only known through its id prefix.
 */
public record MethodDescriptor(String methodId, FactorKind kind, StrengthTier nominalStrength) {
}
