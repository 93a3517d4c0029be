package com.example.authpolicy.registry;

import com.example.authpolicy.policy.exception.NoApplicablePolicyException;
import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.model.ActionSpec;
import com.example.authpolicy.policy.model.MfaRules;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyQuery;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.StrengthTier;
import com.example.authpolicy.util.EngineTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.authpolicy.util.EngineTestFixtures.TENANT;
import static com.example.authpolicy.util.PolicyTestBuilder.aPsd2Policy;
import static com.example.authpolicy.util.PolicyTestBuilder.aStepUpPolicy;
import static com.example.authpolicy.util.PolicyTestBuilder.anAdaptivePolicy;
import static com.example.authpolicy.util.PolicyTestBuilder.anMfaPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryPolicyRegistry")
class InMemoryPolicyRegistryTest {

    private InMemoryPolicyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPolicyRegistry(EngineTestFixtures.validator(EngineTestFixtures.engineProperties()));
    }

    private static PolicyQuery query(String userType) {
        return new PolicyQuery(TENANT, userType, null, null);
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("should bump the version on every successful write")
        void shouldBumpVersion() {
            assertThat(registry.snapshot().version()).isZero();

            assertThat(registry.put(anMfaPolicy().build()).version()).isEqualTo(1L);
            assertThat(registry.put(anMfaPolicy().withPriority(10).build()).version()).isEqualTo(2L);
            assertThat(registry.delete("mfa-base")).isTrue();
            assertThat(registry.snapshot().version()).isEqualTo(3L);
        }

        @Test
        @DisplayName("should reject invalid policies without changing the registry")
        void shouldRejectInvalidPolicy() {
            Policy invalid = anMfaPolicy()
                    .withRules(new MfaRules(ActionSpec.of(3, Set.of("KB-01-02"), StrengthTier.BASIC)))
                    .build();

            assertThatThrownBy(() -> registry.put(invalid))
                    .isInstanceOfSatisfying(PolicyValidationException.class,
                            error -> assertThat(error.getResult().errors()).hasSize(1));
            assertThat(registry.snapshot().version()).isZero();
            assertThat(registry.get("mfa-base")).isEmpty();
        }

        @Test
        @DisplayName("should report deleting an unknown policy")
        void shouldReportUnknownDelete() {
            assertThat(registry.delete("missing")).isFalse();
            assertThat(registry.snapshot().version()).isZero();
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        @DisplayName("should keep a taken snapshot unchanged by later writes")
        void shouldIsolateSnapshots() {
            registry.put(anMfaPolicy().build());
            PolicySnapshot before = registry.snapshot();

            registry.put(aStepUpPolicy().build());
            registry.delete("mfa-base");

            assertThat(before.policies()).containsOnlyKeys("mfa-base");
            assertThat(registry.snapshot().policies()).containsOnlyKeys("step-up");
        }

        @Test
        @DisplayName("should order candidates by priority, specificity and id")
        void shouldOrderCandidates() {
            registry.put(anMfaPolicy().build());
            registry.put(anMfaPolicy().withId("mfa-patient").withUserTypes("patient").build());
            registry.put(aStepUpPolicy().build());
            registry.put(anAdaptivePolicy().build());

            List<Policy> candidates = registry.snapshot().resolveCandidates(query("patient"));

            assertThat(candidates).extracting(Policy::id)
                    .containsExactly("step-up", "adaptive", "mfa-patient", "mfa-base");
        }

        @Test
        @DisplayName("should throw when no policy is in scope")
        void shouldThrowWithoutCandidates() {
            registry.put(anMfaPolicy().withTenantId("tenant-b").build());

            assertThat(registry.snapshot().resolveCandidates(query(null))).isEmpty();
            assertThatThrownBy(() -> registry.snapshot().requireCandidates(query(null)))
                    .isInstanceOf(NoApplicablePolicyException.class);
        }

        @Test
        @DisplayName("should filter listings by tenant, type and enabled flag")
        void shouldFilterListings() {
            registry.put(anMfaPolicy().build());
            registry.put(aPsd2Policy().disabled().build());
            registry.put(aStepUpPolicy().withTenantId("tenant-b").build());

            assertThat(registry.list(PolicyFilter.all())).hasSize(3);
            assertThat(registry.list(new PolicyFilter(TENANT, null, null))).hasSize(2);
            assertThat(registry.list(new PolicyFilter(null, PolicyType.CONDITIONAL, null)))
                    .extracting(Policy::id).containsExactly("psd2");
            assertThat(registry.list(new PolicyFilter(TENANT, null, true)))
                    .extracting(Policy::id).containsExactly("mfa-base");
        }
    }

    @Test
    @DisplayName("should serialize concurrent writers without losing updates")
    void shouldSerializeConcurrentWriters() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PolicySnapshot>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                Policy policy = anMfaPolicy().withId("mfa-" + i).withPriority(i).build();
                results.add(executor.submit(() -> {
                    start.await();
                    return registry.put(policy);
                }));
            }
            start.countDown();
            for (Future<PolicySnapshot> result : results) {
                result.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.snapshot().version()).isEqualTo(writers);
        assertThat(registry.snapshot().policies()).hasSize(writers);
    }
}
