package com.example.authpolicy.policy.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Context-specific relaxation of a conditional policy. Exemptions never add requirements.
 */
public sealed interface ExemptionRule {

    String code();

    /**
     * Payments not exceeding {@code thresholdAmount}, bounded by a cumulative amount
     * and a number of consecutive exempted transactions since the last full authentication.
     */
    record LowValuePayment(
            BigDecimal thresholdAmount,
            BigDecimal cumulativeLimit,
            Integer consecutiveTxLimit
    ) implements ExemptionRule {
        @Override
        public String code() {
            return "LOW_VALUE_PAYMENT";
        }
    }

    /**
     * Beneficiary explicitly trusted by the payer, for at most {@code trustPeriod}.
     */
    record TrustedBeneficiary(Duration trustPeriod) implements ExemptionRule {
        @Override
        public String code() {
            return "TRUSTED_BENEFICIARY";
        }
    }

    /**
     * Real-time transaction risk analysis: fraud rate below the bound and amount within the channel threshold.
     */
    record TransactionRiskAnalysis(
            double fraudRateThreshold,
            Map<ChannelKind, BigDecimal> amountThresholds
    ) implements ExemptionRule {

        public TransactionRiskAnalysis {
            amountThresholds = amountThresholds == null ? Map.of() : Map.copyOf(amountThresholds);
        }

        @Override
        public String code() {
            return "TRANSACTION_RISK_ANALYSIS";
        }
    }
}
