package com.example.authpolicy.signal;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.policy.model.FactorKind;
import com.example.authpolicy.policy.model.StrengthTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps method codes ({@code KB-01-02}, {@code PB-03-01}...) to their factor kind and nominal strength.
 * Methods not configured explicitly fall back to the two-letter family prefix.
 */
@Slf4j
@Component
public class MethodCatalog {

    private static final Map<String, FactorKind> PREFIX_KINDS = Map.of(
            "KB", FactorKind.KNOWLEDGE,
            "PB", FactorKind.POSSESSION,
            "BM", FactorKind.BIOMETRIC,
            "IN", FactorKind.BIOMETRIC,
            "BH", FactorKind.BEHAVIORAL,
            "DV", FactorKind.DEVICE,
            "GE", FactorKind.GEO,
            "BC", FactorKind.BLOCKCHAIN,
            "AI", FactorKind.AI
    );

    private final Map<String, MethodDescriptor> methods = new HashMap<>();

    public MethodCatalog(EngineProperties properties) {
        properties.getMethods().forEach((id, definition) -> {
            if (definition.getKind() == null) {
                throw new IllegalStateException("Method " + id + " has no kind configured");
            }
            String key = normalize(id);
            methods.put(key, new MethodDescriptor(key, definition.getKind(), definition.getStrength()));
        });
        log.info("Method catalog loaded with {} configured methods", methods.size());
    }

    public Optional<MethodDescriptor> lookup(String methodId) {
        String key = normalize(methodId);
        MethodDescriptor descriptor = methods.get(key);
        if (descriptor != null) {
            return Optional.of(descriptor);
        }
        int dash = key.indexOf('-');
        String prefix = dash > 0 ? key.substring(0, dash) : key;
        FactorKind kind = PREFIX_KINDS.get(prefix);
        return kind == null ? Optional.empty() : Optional.of(new MethodDescriptor(key, kind, null));
    }

    public boolean isKnown(String methodId) {
        return lookup(methodId).isPresent();
    }

    /**
     * Distinct kinds reachable through the given methods. Unknown methods contribute nothing.
     */
    public Set<FactorKind> kindsOf(Collection<String> methodIds) {
        return kindsOf(methodIds, null);
    }

    /**
     * Distinct kinds reachable through methods whose nominal strength meets {@code minimum}.
     * Methods without a nominal strength are assumed to meet it.
     */
    public Set<FactorKind> kindsOf(Collection<String> methodIds, StrengthTier minimum) {
        Set<FactorKind> kinds = EnumSet.noneOf(FactorKind.class);
        for (String methodId : methodIds) {
            lookup(methodId)
                    .filter(descriptor -> descriptor.nominalStrength() == null
                            || descriptor.nominalStrength().isAtLeast(minimum))
                    .ifPresent(descriptor -> kinds.add(descriptor.kind()));
        }
        return kinds;
    }

    private static String normalize(String methodId) {
        return methodId == null ? "" : methodId.trim().toUpperCase(Locale.ROOT);
    }
}
