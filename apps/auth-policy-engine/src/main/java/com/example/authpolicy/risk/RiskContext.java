package com.example.authpolicy.risk;

import com.example.authpolicy.policy.model.ChannelKind;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Request context used for risk scoring, conditional rules and exemptions.
 *
 * @param riskSignals               named risk signal values, e.g. {@code new_device -> 1.0}
 * @param contextKeys               conditional context rule keys active for this request
 * @param cumulativeAmount          amount exempted since the last full authentication
 * @param consecutiveTransactions   transactions exempted since the last full authentication
 * @param beneficiaryTrustedSince   when the beneficiary was added to the trusted list
 * @param deviceId                  client device identifier, recorded in the audit trail
 * @param ipAddress                 client address, recorded in the audit trail
 * @param emergencyAttestation      reference of the break-glass attestation given with an
 *                                  {@code emergency_access} context key
 */
@Builder(toBuilder = true)
public record RiskContext(
        Map<String, Double> riskSignals,
        Set<String> contextKeys,
        String operation,
        BigDecimal transactionAmount,
        BigDecimal cumulativeAmount,
        Integer consecutiveTransactions,
        Boolean trustedBeneficiary,
        Instant beneficiaryTrustedSince,
        Double fraudRate,
        ChannelKind channel,
        String deviceId,
        String ipAddress,
        Double deviceTrust,
        String emergencyAttestation
) {
    public RiskContext {
        riskSignals = riskSignals == null ? Map.of() : riskSignals.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
        contextKeys = contextKeys == null ? Set.of() : Set.copyOf(contextKeys);
    }

    public boolean hasEmergencyAttestation() {
        return emergencyAttestation != null && !emergencyAttestation.isBlank();
    }

    public static RiskContext empty() {
        return RiskContext.builder().build();
    }
}
