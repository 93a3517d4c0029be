package com.example.authpolicy.signal;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.signal.model.AggregatedSignals;
import com.example.authpolicy.signal.model.FactorEvidence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes raw factor evidence before policy resolution.
 *
 * <ol>
 *   <li>keeps the most recent observation of each (kind, method)</li>
 *   <li>drops observations outside the staleness window with a {@code StaleEvidenceWarning}</li>
 *   <li>drops observations failing the evidence comparator of their kind</li>
 * </ol>
 * The result does not depend on input order.
 */
@Slf4j
@Component
public class SignalAggregator {

    public static final String STALE_EVIDENCE_WARNING = "StaleEvidenceWarning";

    static final Comparator<FactorEvidence> CANONICAL_ORDER = Comparator
            .comparing(FactorEvidence::kind)
            .thenComparing(FactorEvidence::methodId);

    private static final Comparator<FactorEvidence> PREFERENCE = Comparator
            .comparing(FactorEvidence::observedAt)
            .thenComparingDouble(FactorEvidence::score)
            .thenComparing(FactorEvidence::strength);

    private final Duration staleness;
    private final ComparatorTable comparators;

    public SignalAggregator(EngineProperties properties, ComparatorTable comparators) {
        this.staleness = properties.getEvidenceStaleness();
        this.comparators = comparators;
    }

    public AggregatedSignals aggregate(List<FactorEvidence> raw, Instant now) {
        if (raw == null || raw.isEmpty()) {
            return AggregatedSignals.empty();
        }

        Map<String, FactorEvidence> latest = new LinkedHashMap<>();
        for (FactorEvidence evidence : raw) {
            if (evidence == null) {
                continue;
            }
            latest.merge(evidence.label(), evidence,
                    (current, candidate) -> PREFERENCE.compare(candidate, current) > 0 ? candidate : current);
        }

        List<FactorEvidence> observations = new ArrayList<>(latest.values());
        observations.sort(CANONICAL_ORDER);

        List<FactorEvidence> usable = new ArrayList<>();
        List<FactorEvidence> stale = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<FactorKind, StrengthTier> maxStrength = new EnumMap<>(FactorKind.class);

        for (FactorEvidence evidence : observations) {
            if (evidence.isOlderThan(staleness, now)) {
                stale.add(evidence);
                warnings.add(String.format("%s: %s observed at %s is outside the %s staleness window",
                        STALE_EVIDENCE_WARNING, evidence.label(), evidence.observedAt(), staleness));
                continue;
            }
            SignalComparator comparator = comparators.forEvidence(evidence.kind());
            if (comparator.breaches(evidence.score())) {
                warnings.add(String.format("%s rejected: score %.2f fails %s",
                        evidence.label(), evidence.score(), comparator.describe()));
                continue;
            }
            usable.add(evidence);
            maxStrength.merge(evidence.kind(), evidence.strength(),
                    (a, b) -> a.compareTo(b) >= 0 ? a : b);
        }

        if (!warnings.isEmpty()) {
            log.debug("Evidence aggregation dropped {} of {} observations", observations.size() - usable.size(),
                    observations.size());
        }
        return new AggregatedSignals(usable, maxStrength, stale, warnings);
    }
}
