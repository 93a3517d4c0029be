package com.example.authpolicy.decision.engine;

import com.example.authpolicy.policy.model.ExemptionRule;
import com.example.authpolicy.risk.RiskContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Checks PSD2-style exemptions against the request context. Exemptions are tried in declaration order.
 */
@Component
public class ExemptionEvaluator {

    public record ExemptionCheck(ExemptionRule rule, boolean matched, String reason) {
    }

    public Optional<ExemptionCheck> firstMatch(List<ExemptionRule> exemptions, RiskContext context, Instant now,
                                               List<String> reasons) {
        for (ExemptionRule exemption : exemptions) {
            ExemptionCheck check = check(exemption, context, now);
            reasons.add(check.reason());
            if (check.matched()) {
                return Optional.of(check);
            }
        }
        return Optional.empty();
    }

    public ExemptionCheck check(ExemptionRule exemption, RiskContext context, Instant now) {
        if (exemption instanceof ExemptionRule.LowValuePayment lowValue) {
            return checkLowValue(lowValue, context);
        }
        if (exemption instanceof ExemptionRule.TrustedBeneficiary trusted) {
            return checkTrustedBeneficiary(trusted, context, now);
        }
        if (exemption instanceof ExemptionRule.TransactionRiskAnalysis analysis) {
            return checkTransactionRisk(analysis, context);
        }
        throw new IllegalStateException("Unsupported exemption: " + exemption.code());
    }

    private ExemptionCheck checkLowValue(ExemptionRule.LowValuePayment rule, RiskContext context) {
        BigDecimal amount = context.transactionAmount();
        if (amount == null) {
            return notApplicable(rule, "no transaction amount");
        }
        if (amount.compareTo(rule.thresholdAmount()) > 0) {
            return notApplicable(rule, String.format("amount %s exceeds %s",
                    amount.toPlainString(), rule.thresholdAmount().toPlainString()));
        }
        if (rule.cumulativeLimit() != null) {
            BigDecimal cumulative = context.cumulativeAmount() == null ? BigDecimal.ZERO : context.cumulativeAmount();
            BigDecimal total = cumulative.add(amount);
            if (total.compareTo(rule.cumulativeLimit()) > 0) {
                return notApplicable(rule, String.format("cumulative amount %s exceeds %s",
                        total.toPlainString(), rule.cumulativeLimit().toPlainString()));
            }
        }
        if (rule.consecutiveTxLimit() != null) {
            int consecutive = context.consecutiveTransactions() == null ? 0 : context.consecutiveTransactions();
            if (consecutive >= rule.consecutiveTxLimit()) {
                return notApplicable(rule, String.format("%d consecutive exempted transactions reached limit %d",
                        consecutive, rule.consecutiveTxLimit()));
            }
        }
        return matched(rule, String.format("amount %s does not exceed %s",
                amount.toPlainString(), rule.thresholdAmount().toPlainString()));
    }

    private ExemptionCheck checkTrustedBeneficiary(ExemptionRule.TrustedBeneficiary rule, RiskContext context,
                                                   Instant now) {
        if (!Boolean.TRUE.equals(context.trustedBeneficiary())) {
            return notApplicable(rule, "beneficiary is not trusted");
        }
        Instant since = context.beneficiaryTrustedSince();
        if (since == null) {
            return notApplicable(rule, "trust start unknown");
        }
        if (since.plus(rule.trustPeriod()).isBefore(now)) {
            return notApplicable(rule, String.format("trust granted at %s expired after %s", since,
                    rule.trustPeriod()));
        }
        return matched(rule, String.format("beneficiary trusted since %s", since));
    }

    private ExemptionCheck checkTransactionRisk(ExemptionRule.TransactionRiskAnalysis rule, RiskContext context) {
        if (context.fraudRate() == null) {
            return notApplicable(rule, "no fraud rate");
        }
        if (context.fraudRate() >= rule.fraudRateThreshold()) {
            return notApplicable(rule, String.format("fraud rate %s is not below %s",
                    context.fraudRate(), rule.fraudRateThreshold()));
        }
        if (context.channel() == null || !rule.amountThresholds().containsKey(context.channel())) {
            return notApplicable(rule, "channel " + context.channel() + " has no amount threshold");
        }
        BigDecimal limit = rule.amountThresholds().get(context.channel());
        BigDecimal amount = context.transactionAmount();
        if (amount == null) {
            return notApplicable(rule, "no transaction amount");
        }
        if (amount.compareTo(limit) > 0) {
            return notApplicable(rule, String.format("amount %s exceeds %s limit %s",
                    amount.toPlainString(), context.channel(), limit.toPlainString()));
        }
        return matched(rule, String.format("fraud rate %s below %s and amount %s within %s limit %s",
                context.fraudRate(), rule.fraudRateThreshold(), amount.toPlainString(), context.channel(),
                limit.toPlainString()));
    }

    private static ExemptionCheck matched(ExemptionRule rule, String detail) {
        return new ExemptionCheck(rule, true, String.format("exemption %s applied: %s", rule.code(), detail));
    }

    private static ExemptionCheck notApplicable(ExemptionRule rule, String detail) {
        return new ExemptionCheck(rule, false, String.format("exemption %s not applicable: %s", rule.code(), detail));
    }
}
