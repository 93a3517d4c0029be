package com.example.authpolicy.decision.controller;

import com.example.authpolicy.common.exception.GlobalExceptionHandler;
import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.decision.engine.AuthenticationPolicyEngine;
import com.example.authpolicy.decision.service.EvaluationService;
import com.example.authpolicy.observability.metrics.DecisionMetrics;
import com.example.authpolicy.registry.InMemoryPolicyRegistry;
import com.example.authpolicy.signal.EvidenceNormalizer;
import com.example.authpolicy.util.EngineTestFixtures;
import com.example.authpolicy.util.JsonTestCodecs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.authpolicy.util.EngineTestFixtures.NOW;
import static com.example.authpolicy.util.PolicyTestBuilder.anMfaPolicy;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EvaluationController")
class EvaluationControllerTest {

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        EngineProperties properties = EngineTestFixtures.engineProperties();
        InMemoryPolicyRegistry registry = new InMemoryPolicyRegistry(EngineTestFixtures.validator(properties));
        registry.put(anMfaPolicy().build());

        AuthenticationPolicyEngine engine = new AuthenticationPolicyEngine(
                registry,
                EngineTestFixtures.aggregator(properties),
                EngineTestFixtures.riskScorer(properties),
                EngineTestFixtures.resolver(properties),
                properties);
        EvaluationService service = new EvaluationService(
                engine, new DecisionMetrics(new SimpleMeterRegistry()), null);
        EvaluationController controller = new EvaluationController(
                service,
                new EvidenceNormalizer(EngineTestFixtures.methodCatalog(properties), List.of()),
                Clock.fixed(NOW, ZoneOffset.UTC));

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .httpMessageCodecs(JsonTestCodecs::configure)
                .build();
    }

    private WebTestClient.ResponseSpec evaluate(String json) {
        return webTestClient.post()
                .uri("/api/v1/evaluations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .exchange();
    }

    @Nested
    @DisplayName("POST /api/v1/evaluations")
    class Evaluate {

        @Test
        @DisplayName("should accept two verified factors of different kinds")
        void shouldAcceptTwoFactors() {
            evaluate("""
                    {
                      "tenant_id": "tenant-a",
                      "operation": "login",
                      "evidence": [
                        {"method_id": "KB-01-02", "valid": true, "observed_at": "2026-03-01T11:59:00Z"},
                        {"method_id": "PB-03-02", "valid": true, "observed_at": "2026-03-01T11:59:30Z"}
                      ]
                    }
                    """)
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.verdict").isEqualTo("ACCEPT")
                    .jsonPath("$.applied_policy_id").isEqualTo("mfa-base")
                    .jsonPath("$.applied_policy_type").isEqualTo("MFA")
                    .jsonPath("$.satisfied_factors.length()").isEqualTo(2)
                    .jsonPath("$.satisfied_factors[0].kind").isEqualTo("KNOWLEDGE")
                    .jsonPath("$.satisfied_factors[1].method_id").isEqualTo("PB-03-02")
                    .jsonPath("$.evaluated_at").isEqualTo("2026-03-01T12:00:00Z")
                    .jsonPath("$.registry_version").exists();
        }

        @Test
        @DisplayName("should reject when a verification failed and one factor remains")
        void shouldRejectWhenVerificationFailed() {
            evaluate("""
                    {
                      "tenant_id": "tenant-a",
                      "evidence": [
                        {"method_id": "KB-01-02", "valid": true, "observed_at": "2026-03-01T11:59:00Z"},
                        {"method_id": "PB-03-02", "valid": false, "observed_at": "2026-03-01T11:59:30Z"}
                      ]
                    }
                    """)
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.verdict").isEqualTo("REJECT")
                    .jsonPath("$.satisfied_factors.length()").isEqualTo(1)
                    .jsonPath("$.reasons").isNotEmpty();
        }

        @Test
        @DisplayName("should return 400 when tenant id is blank")
        void shouldRejectBlankTenant() {
            evaluate("""
                    {"tenant_id": " ", "evidence": []}
                    """)
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("validation_error");
        }

        @Test
        @DisplayName("should return 400 for an unknown strength tier")
        void shouldRejectUnknownStrength() {
            evaluate("""
                    {
                      "tenant_id": "tenant-a",
                      "evidence": [
                        {"method_id": "KB-01-02", "valid": true, "strength": "ULTRA",
                         "observed_at": "2026-03-01T11:59:00Z"}
                      ]
                    }
                    """)
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid_argument")
                    .jsonPath("$.message").isEqualTo("Unknown strength tier: ULTRA");
        }

        @Test
        @DisplayName("should return 500 configuration error when no policy applies to the tenant")
        void shouldReturnConfigurationErrorForUnknownTenant() {
            evaluate("""
                    {"tenant_id": "tenant-unknown", "evidence": []}
                    """)
                    .expectStatus().is5xxServerError()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("policy_configuration_error")
                    .jsonPath("$.code").isEqualTo("PolicyNotFoundError")
                    .jsonPath("$.message").value(message -> assertThat((String) message)
                            .contains("tenant=tenant-unknown"));
        }
    }
}
