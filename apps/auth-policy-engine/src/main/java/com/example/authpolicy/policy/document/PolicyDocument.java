package com.example.authpolicy.policy.document;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Untyped policy as written in configuration or sent to the admin API.
 *
 * <p>Every field is optional at this level; {@link com.example.authpolicy.policy.validation.PolicyValidator}
 * reports what is missing before {@link PolicyDocumentMapper} builds the typed model.
 */
public record PolicyDocument(
        String id,
        String tenantId,
        String name,
        String description,
        String type,
        RulesDocument rules,
        Set<String> appliesToUserTypes,
        Set<String> appliesToSecurityProfiles,
        Set<String> appliesToRegions,
        Boolean enabled,
        Integer priority
) {

    /**
     * Union of the rule fields of all policy types. Which ones are required depends on the type.
     */
    public record RulesDocument(
            // MFA and STEP_UP
            Integer requiredFactors,
            Set<String> allowedMethods,
            String minimumFactorStrength,
            Set<String> mandatoryFactorCategories,
            Duration maxSessionDuration,
            // STEP_UP
            Set<String> highRiskOperations,
            Duration maxLastFactorAge,
            Boolean requireFreshAuthentication,
            // ADAPTIVE
            Map<String, Double> riskFactors,
            ThresholdsDocument riskThresholds,
            Map<String, ActionDocument> actions,
            // RISK_BASED
            Map<String, ActionDocument> riskLevels,
            // CONDITIONAL
            ActionDocument baseRequirements,
            Map<String, ActionDocument> contextRules,
            ExemptionsDocument exemptions,
            EmergencyAccessDocument emergencyAccess
    ) {
    }

    public record ActionDocument(
            Integer requiredFactors,
            Set<String> allowedMethods,
            String minimumFactorStrength,
            Set<String> mandatoryFactorCategories,
            Duration maxSessionDuration
    ) {
    }

    public record ThresholdsDocument(Double low, Double medium, Double high) {
    }

    public record ExemptionsDocument(
            LowValuePaymentDocument lowValuePayment,
            TrustedBeneficiaryDocument trustedBeneficiary,
            TransactionRiskAnalysisDocument transactionRiskAnalysis
    ) {
    }

    public record LowValuePaymentDocument(
            BigDecimal thresholdAmount,
            BigDecimal cumulativeLimit,
            Integer consecutiveTransactions
    ) {
    }

    public record TrustedBeneficiaryDocument(Duration trustPeriod) {
    }

    public record EmergencyAccessDocument(
            Boolean enabled,
            Boolean requiresAttestation,
            Integer limitedAccessMinutes,
            Boolean requiresPostAttestation
    ) {
    }

    public record TransactionRiskAnalysisDocument(
            Double fraudRateThreshold,
            Map<String, BigDecimal> amountThresholds
    ) {
    }
}
