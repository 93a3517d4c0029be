package com.example.authpolicy.decision.engine;

import com.example.authpolicy.policy.model.ActionSpec;
import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.signal.model.FactorEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts distinct factor kinds among qualifying evidence. Two factors of the same kind count once.
 */
@Component
public class FactorRequirementEvaluator {

    private static final Comparator<FactorEvidence> BEST = Comparator
            .comparing(FactorEvidence::strength)
            .thenComparing(FactorEvidence::observedAt)
            .thenComparing(FactorEvidence::methodId, Comparator.reverseOrder());

    public RequirementOutcome evaluate(ActionSpec spec, List<FactorEvidence> evidence) {
        List<String> reasons = new ArrayList<>();
        Map<FactorKind, FactorEvidence> bestByKind = new EnumMap<>(FactorKind.class);

        for (FactorEvidence factor : evidence) {
            if (!spec.allowsMethod(factor.methodId())) {
                reasons.add(String.format("%s not counted: method not allowed", factor.label()));
                continue;
            }
            if (!factor.strength().isAtLeast(spec.minimumFactorStrength())) {
                reasons.add(String.format("%s not counted: strength %s below %s",
                        factor.label(), factor.strength(), spec.minimumFactorStrength()));
                continue;
            }
            bestByKind.merge(factor.kind(), factor, (a, b) -> BEST.compare(a, b) >= 0 ? a : b);
        }

        List<FactorEvidence> satisfied = new ArrayList<>(bestByKind.values());
        Set<FactorKind> missingMandatory = EnumSet.noneOf(FactorKind.class);
        missingMandatory.addAll(spec.mandatoryFactorCategories());
        missingMandatory.removeAll(bestByKind.keySet());

        boolean enough = satisfied.size() >= spec.requiredFactors();
        if (!enough) {
            reasons.add(String.format("insufficient distinct factor kinds: %d < %d",
                    satisfied.size(), spec.requiredFactors()));
        }
        if (!missingMandatory.isEmpty()) {
            reasons.add("missing mandatory factor categories: " + missingMandatory);
        }
        boolean ok = enough && missingMandatory.isEmpty();
        if (ok) {
            reasons.add(String.format("satisfied %d of %d required factor kinds: %s",
                    satisfied.size(), spec.requiredFactors(), bestByKind.keySet()));
        }
        return new RequirementOutcome(ok, satisfied, missingMandatory, reasons);
    }
}
