package com.example.authpolicy.observability.metrics;

import com.example.authpolicy.decision.model.Decision;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Metrics for policy evaluations. Tag values are bounded enums or sanitized codes.
 */
@Component
public class DecisionMetrics {

    private static final String TAG_UNKNOWN = "unknown";
    private static final String TAG_NONE = "none";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;
    private final Timer evaluationTimer;

    public DecisionMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
        this.evaluationTimer = Timer.builder("auth.policy.evaluation")
                .description("Policy evaluation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordDecision(@NonNull Decision decision) {
        registry.counter("auth.policy.decision",
                Tags.of("verdict", decision.verdict().name().toLowerCase(),
                        "policy_type", decision.appliedPolicyType() != null
                                ? decision.appliedPolicyType().name().toLowerCase()
                                : TAG_NONE))
                .increment();

        if (decision.appliedExemption() != null) {
            registry.counter("auth.policy.exemption",
                    Tags.of("exemption", decision.appliedExemption().code().toLowerCase()))
                    .increment();
        }
    }

    public void recordError(@Nullable String errorCode) {
        registry.counter("auth.policy.error", Tags.of("code", sanitizeTag(errorCode))).increment();
    }

    @NonNull
    public Timer.Sample startEvaluation() {
        return Timer.start(registry);
    }

    public void stopEvaluation(@NonNull Timer.Sample sample) {
        sample.stop(evaluationTimer);
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
