package com.example.authpolicy.risk;

import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.signal.ComparatorTable;
import com.example.authpolicy.signal.SignalComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Additive risk scoring. Each weighted signal whose value breaches its comparator adds its weight;
 * the total is bucketed with the model thresholds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskScorer {

    static final String DEVICE_TRUST_SIGNAL = "device_trust";

    private final ComparatorTable comparators;

    public RiskAssessment assess(RiskModel model, RiskContext context) {
        Map<String, Double> signals = signalsOf(context);
        Map<String, Double> weights = new TreeMap<>();
        model.weights().forEach((name, weight) -> weights.put(ComparatorTable.normalize(name), weight));

        double score = 0.0;
        List<String> contributing = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double value = signals.get(entry.getKey());
            if (value == null) {
                continue;
            }
            SignalComparator comparator = comparators.forRiskSignal(entry.getKey());
            if (comparator.breaches(value)) {
                score += entry.getValue();
                contributing.add(entry.getKey());
                reasons.add(String.format("risk signal %s=%.2f breaches %s (+%s)",
                        entry.getKey(), value, comparator.describe(), formatWeight(entry.getValue())));
            }
        }

        RiskTier tier = model.thresholds().tierFor(score);
        reasons.add(String.format("risk score %s maps to tier %s", formatWeight(score), tier));
        log.debug("Risk assessed: score={}, tier={}, signals={}", score, tier, contributing);
        return new RiskAssessment(score, tier, contributing, reasons);
    }

    private static Map<String, Double> signalsOf(RiskContext context) {
        Map<String, Double> signals = new HashMap<>();
        context.riskSignals().forEach((name, value) -> {
            if (value != null) {
                signals.put(ComparatorTable.normalize(name), value);
            }
        });
        if (context.deviceTrust() != null) {
            signals.putIfAbsent(DEVICE_TRUST_SIGNAL, context.deviceTrust());
        }
        return signals;
    }

    private static String formatWeight(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
