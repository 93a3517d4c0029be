package com.example.authpolicy.util;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.decision.engine.DecisionResolver;
import com.example.authpolicy.decision.engine.ExemptionEvaluator;
import com.example.authpolicy.decision.engine.FactorRequirementEvaluator;
import com.example.authpolicy.policy.document.PolicyDocumentMapper;
import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.policy.validation.PolicyValidator;
import com.example.authpolicy.risk.RiskScorer;
import com.example.authpolicy.signal.ComparatorTable;
import com.example.authpolicy.signal.MethodCatalog;
import com.example.authpolicy.signal.SignalAggregator;

import java.time.Instant;

/**
 * Wires engine components by hand with the method catalog used across tests.
 */
public final class EngineTestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final String TENANT = "tenant-a";

    private EngineTestFixtures() {
    }

    public static EngineProperties engineProperties() {
        EngineProperties properties = new EngineProperties();
        method(properties, "KB-01-01", FactorKind.KNOWLEDGE, StrengthTier.BASIC);
        method(properties, "KB-01-02", FactorKind.KNOWLEDGE, StrengthTier.INTERMEDIATE);
        method(properties, "PB-01-01", FactorKind.POSSESSION, StrengthTier.ADVANCED);
        method(properties, "PB-01-03", FactorKind.POSSESSION, StrengthTier.ADVANCED);
        method(properties, "PB-03-01", FactorKind.POSSESSION, StrengthTier.ADVANCED);
        method(properties, "PB-03-02", FactorKind.POSSESSION, StrengthTier.INTERMEDIATE);
        method(properties, "IN-01-01", FactorKind.BIOMETRIC, StrengthTier.ADVANCED);
        method(properties, "IN-03-01", FactorKind.BIOMETRIC, StrengthTier.ADVANCED);
        method(properties, "OB-01-01", FactorKind.POSSESSION, StrengthTier.VERY_ADVANCED);
        return properties;
    }

    public static void method(EngineProperties properties, String id, FactorKind kind, StrengthTier strength) {
        EngineProperties.MethodDefinition definition = new EngineProperties.MethodDefinition();
        definition.setKind(kind);
        definition.setStrength(strength);
        properties.getMethods().put(id, definition);
    }

    public static MethodCatalog methodCatalog(EngineProperties properties) {
        return new MethodCatalog(properties);
    }

    public static PolicyValidator validator(EngineProperties properties) {
        return new PolicyValidator(new MethodCatalog(properties), new PolicyDocumentMapper());
    }

    public static SignalAggregator aggregator(EngineProperties properties) {
        return new SignalAggregator(properties, new ComparatorTable(properties));
    }

    public static RiskScorer riskScorer(EngineProperties properties) {
        return new RiskScorer(new ComparatorTable(properties));
    }

    public static DecisionResolver resolver(EngineProperties properties) {
        return new DecisionResolver(new FactorRequirementEvaluator(), new ExemptionEvaluator(), riskScorer(properties));
    }
}
