package com.example.authpolicy.signal.model;

import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalized evidence set handed to the resolver.
 *
 * @param evidence          usable evidence, one entry per (kind, method), ordered by kind then method
 * @param maxStrengthByKind strongest usable strength seen for each kind
 * @param staleEvidence     evidence dropped because it is outside the staleness window
 * @param warnings          explanation of everything that was dropped
 */
public record AggregatedSignals(
        List<FactorEvidence> evidence,
        Map<FactorKind, StrengthTier> maxStrengthByKind,
        List<FactorEvidence> staleEvidence,
        List<String> warnings
) {
    public AggregatedSignals {
        evidence = List.copyOf(evidence);
        maxStrengthByKind = Map.copyOf(maxStrengthByKind);
        staleEvidence = List.copyOf(staleEvidence);
        warnings = List.copyOf(warnings);
    }

    public static AggregatedSignals empty() {
        return new AggregatedSignals(List.of(), Map.of(), List.of(), List.of());
    }

    public Set<FactorKind> kinds() {
        return maxStrengthByKind.keySet();
    }
}
