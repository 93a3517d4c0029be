package com.example.authpolicy.decision.dto;

import com.example.authpolicy.policy.model.ChannelKind;
import com.example.authpolicy.risk.RiskContext;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record RiskContextRequest(
        Map<String, Double> riskSignals,
        Set<String> contextKeys,
        @PositiveOrZero BigDecimal transactionAmount,
        @PositiveOrZero BigDecimal cumulativeAmount,
        @PositiveOrZero Integer consecutiveTransactions,
        Boolean trustedBeneficiary,
        Instant beneficiaryTrustedSince,
        @DecimalMin("0.0") @DecimalMax("1.0") Double fraudRate,
        String channel,
        String deviceId,
        String ipAddress,
        @DecimalMin("0.0") @DecimalMax("1.0") Double deviceTrust,
        @Size(max = 256) String emergencyAttestation
) {
    public RiskContext toRiskContext(String operation) {
        ChannelKind channelKind = null;
        if (channel != null) {
            channelKind = ChannelKind.fromValue(channel)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + channel));
        }
        return RiskContext.builder()
                .riskSignals(riskSignals)
                .contextKeys(contextKeys)
                .operation(operation)
                .transactionAmount(transactionAmount)
                .cumulativeAmount(cumulativeAmount)
                .consecutiveTransactions(consecutiveTransactions)
                .trustedBeneficiary(trustedBeneficiary)
                .beneficiaryTrustedSince(beneficiaryTrustedSince)
                .fraudRate(fraudRate)
                .channel(channelKind)
                .deviceId(deviceId)
                .ipAddress(ipAddress)
                .deviceTrust(deviceTrust)
                .emergencyAttestation(emergencyAttestation)
                .build();
    }
}
