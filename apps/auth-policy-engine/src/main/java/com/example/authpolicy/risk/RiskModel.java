package com.example.authpolicy.risk;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.policy.model.AdaptiveRules;
import com.example.authpolicy.policy.model.RiskThresholds;

import java.util.Map;

/**
 * Signal weights plus tier cut points.
 */
public record RiskModel(Map<String, Double> weights, RiskThresholds thresholds) {

    public RiskModel {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    public static RiskModel of(AdaptiveRules rules) {
        return new RiskModel(rules.riskFactors(), rules.riskThresholds());
    }

    public static RiskModel of(EngineProperties.RiskModel config) {
        return new RiskModel(config.getWeights(),
                new RiskThresholds(config.getLow(), config.getMedium(), config.getHigh()));
    }
}
