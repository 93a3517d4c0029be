package com.example.authpolicy.config.properties;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.signal.SignalComparator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "app.engine")
public class EngineProperties {

    private Duration evidenceStaleness = Duration.ofMinutes(15);
    private NoPolicyBehavior noPolicyBehavior = NoPolicyBehavior.FAIL;
    private RiskModel defaultRiskModel = new RiskModel();
    private Comparators comparators = new Comparators();
    private Map<String, SignalDefinition> signals = defaultSignals();
    private Map<String, MethodDefinition> methods = new LinkedHashMap<>();
    private Audit audit = new Audit();

    /**
     * What an evaluation does when no enabled policy is in scope. There is no implicit fallback.
     */
    public enum NoPolicyBehavior {
        FAIL,   // PolicyNotFoundError
        DENY,   // REJECT decision attributed to DEFAULT_DENY
        ALLOW   // ACCEPT decision attributed to DEFAULT_ALLOW
    }

    /**
     * Weights and thresholds used by RISK_BASED policies and for the baseline tier reported on every decision.
     */
    @Data
    public static class RiskModel {
        private Map<String, Double> weights = defaultWeights();
        private double low = 30;
        private double medium = 60;
        private double high = 80;
    }

    @Data
    public static class Comparators {
        private SignalComparator.Direction evidenceDirection = SignalComparator.Direction.QUALITY;
        private double evidenceThreshold = 0.5;
        private double riskThreshold = 0.5;
        private Map<FactorKind, ComparatorDefinition> evidence = new EnumMap<>(FactorKind.class);
        private Map<FactorKind, ComparatorDefinition> risk = new EnumMap<>(FactorKind.class);
    }

    @Data
    public static class ComparatorDefinition {
        private SignalComparator.Direction direction;
        private double threshold;
    }

    /**
     * Named risk signal. {@code direction} and {@code threshold} override the comparator of its kind.
     */
    @Data
    public static class SignalDefinition {
        private FactorKind kind;
        private SignalComparator.Direction direction;
        private Double threshold;

        static SignalDefinition of(FactorKind kind) {
            SignalDefinition definition = new SignalDefinition();
            definition.setKind(kind);
            return definition;
        }
    }

    @Data
    public static class MethodDefinition {
        private FactorKind kind;
        private StrengthTier strength;
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("new_device", 40.0);
        weights.put("unusual_location", 30.0);
        weights.put("unusual_time", 20.0);
        weights.put("vpn_proxy", 30.0);
        weights.put("impossible_travel", 70.0);
        weights.put("unknown_ip", 20.0);
        weights.put("suspicious_behavior", 50.0);
        return weights;
    }

    private static Map<String, SignalDefinition> defaultSignals() {
        Map<String, SignalDefinition> signals = new LinkedHashMap<>();
        signals.put("new_device", SignalDefinition.of(FactorKind.DEVICE));
        signals.put("unknown_ip", SignalDefinition.of(FactorKind.DEVICE));
        signals.put("unusual_location", SignalDefinition.of(FactorKind.GEO));
        signals.put("vpn_proxy", SignalDefinition.of(FactorKind.GEO));
        signals.put("impossible_travel", SignalDefinition.of(FactorKind.GEO));
        signals.put("unusual_time", SignalDefinition.of(FactorKind.BEHAVIORAL));
        signals.put("suspicious_behavior", SignalDefinition.of(FactorKind.BEHAVIORAL));

        SignalDefinition deviceTrust = SignalDefinition.of(FactorKind.DEVICE);
        deviceTrust.setDirection(SignalComparator.Direction.QUALITY);
        deviceTrust.setThreshold(0.5);
        signals.put("device_trust", deviceTrust);
        return signals;
    }
}
