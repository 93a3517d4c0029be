package com.example.authpolicy.signal;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.config.properties.EngineProperties.ComparatorDefinition;
import com.example.authpolicy.config.properties.EngineProperties.SignalDefinition;
import com.example.authpolicy.policy.model.FactorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative comparator table.
 *
 * <p>Evidence comparators decide whether a verifier score is good enough to count as a factor.
 * Risk comparators decide whether a risk signal in the context is anomalous and adds its weight.
 * A named signal resolves to its own override first, then to the comparator of its {@link FactorKind},
 * then to the table default.
 */
@Slf4j
@Component
public class ComparatorTable {

    private final Map<FactorKind, SignalComparator> evidenceComparators = new EnumMap<>(FactorKind.class);
    private final Map<FactorKind, SignalComparator> riskComparators = new EnumMap<>(FactorKind.class);
    private final Map<String, FactorKind> signalKinds = new HashMap<>();
    private final Map<String, SignalComparator> signalOverrides = new HashMap<>();
    private final SignalComparator defaultEvidence;
    private final SignalComparator defaultRisk;

    public ComparatorTable(EngineProperties properties) {
        EngineProperties.Comparators config = properties.getComparators();
        this.defaultEvidence = new SignalComparator(config.getEvidenceDirection(), config.getEvidenceThreshold());
        this.defaultRisk = SignalComparator.risk(config.getRiskThreshold());

        config.getEvidence().forEach((kind, definition) -> evidenceComparators.put(kind, toComparator(definition)));
        config.getRisk().forEach((kind, definition) -> riskComparators.put(kind, toComparator(definition)));

        properties.getSignals().forEach((name, definition) -> registerSignal(normalize(name), definition));

        log.info("Comparator table initialized: {} evidence, {} risk, {} named signals",
                evidenceComparators.size(), riskComparators.size(), signalKinds.size());
    }

    public SignalComparator forEvidence(FactorKind kind) {
        return evidenceComparators.getOrDefault(kind, defaultEvidence);
    }

    public SignalComparator forRiskSignal(String signal) {
        String key = normalize(signal);
        SignalComparator override = signalOverrides.get(key);
        if (override != null) {
            return override;
        }
        return kindOf(key)
                .map(kind -> riskComparators.getOrDefault(kind, defaultRisk))
                .orElse(defaultRisk);
    }

    /**
     * Kind of a named signal. A signal named after a kind ("AI", "blockchain") is that kind.
     */
    public Optional<FactorKind> kindOf(String signal) {
        String key = normalize(signal);
        FactorKind kind = signalKinds.get(key);
        if (kind != null) {
            return Optional.of(kind);
        }
        return FactorKind.fromValue(key);
    }

    public static String normalize(String signal) {
        return signal == null ? "" : signal.trim().toLowerCase(Locale.ROOT);
    }

    private void registerSignal(String name, SignalDefinition definition) {
        if (definition.getKind() != null) {
            signalKinds.put(name, definition.getKind());
        }
        if (definition.getDirection() != null || definition.getThreshold() != null) {
            SignalComparator base = definition.getKind() != null
                    ? riskComparators.getOrDefault(definition.getKind(), defaultRisk)
                    : defaultRisk;
            signalOverrides.put(name, new SignalComparator(
                    definition.getDirection() != null ? definition.getDirection() : base.direction(),
                    definition.getThreshold() != null ? definition.getThreshold() : base.threshold()));
        }
    }

    private static SignalComparator toComparator(ComparatorDefinition definition) {
        SignalComparator.Direction direction = definition.getDirection() != null
                ? definition.getDirection()
                : SignalComparator.Direction.RISK;
        return new SignalComparator(direction, definition.getThreshold());
    }
}
