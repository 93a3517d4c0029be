package com.example.authpolicy.risk;

import com.example.authpolicy.config.properties.EngineProperties;
import com.example.authpolicy.policy.model.RiskThresholds;
import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.util.EngineTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RiskScorer")
class RiskScorerTest {

    private static final RiskModel MODEL = new RiskModel(
            Map.of("new_device", 40.0, "unusual_location", 30.0, "impossible_travel", 70.0),
            new RiskThresholds(30, 60, 80));

    private RiskScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = EngineTestFixtures.riskScorer(EngineTestFixtures.engineProperties());
    }

    private static RiskContext signals(Map<String, Double> riskSignals) {
        return RiskContext.builder().riskSignals(riskSignals).build();
    }

    @Test
    @DisplayName("should score a new device at 40 and bucket it with lower bounds")
    void shouldScoreNewDevice() {
        RiskAssessment assessment = scorer.assess(MODEL, signals(Map.of("new_device", 1.0)));

        assertThat(assessment.score()).isEqualTo(40.0);
        assertThat(assessment.tier()).isEqualTo(RiskTier.LOW);
        assertThat(assessment.contributingSignals()).containsExactly("new_device");
        assertThat(assessment.reasons()).last().isEqualTo("risk score 40 maps to tier LOW");
    }

    @Test
    @DisplayName("should escalate a new device to MEDIUM when the medium bound is 40")
    void shouldEscalateNewDeviceToMedium() {
        RiskModel model = new RiskModel(Map.of("new_device", 40.0, "impossible_travel", 70.0),
                new RiskThresholds(30, 40, 80));

        RiskAssessment assessment = scorer.assess(model, signals(Map.of("new_device", 1.0)));

        assertThat(assessment.tier()).isEqualTo(RiskTier.MEDIUM);
        assertThat(assessment.reasons()).first().asString()
                .startsWith("risk signal new_device=")
                .endsWith("(+40)");
    }

    @Test
    @DisplayName("should return NONE with no anomalous signal")
    void shouldReturnNoneWithoutSignals() {
        RiskAssessment assessment = scorer.assess(MODEL, RiskContext.empty());

        assertThat(assessment.score()).isZero();
        assertThat(assessment.tier()).isEqualTo(RiskTier.NONE);
        assertThat(assessment.contributingSignals()).isEmpty();
    }

    @Test
    @DisplayName("should ignore signals below their comparator threshold and unweighted signals")
    void shouldIgnoreNonBreachingSignals() {
        RiskAssessment assessment = scorer.assess(MODEL, signals(Map.of(
                "new_device", 0.2,
                "vpn_proxy", 1.0)));

        assertThat(assessment.score()).isZero();
    }

    @Nested
    @DisplayName("Tier boundaries")
    class TierBoundaries {

        @Test
        @DisplayName("should place a score equal to a threshold in the higher tier")
        void shouldPlaceBoundaryScoreInHigherTier() {
            RiskModel model = new RiskModel(Map.of("new_device", 60.0), new RiskThresholds(30, 60, 80));

            RiskAssessment assessment = scorer.assess(model, signals(Map.of("new_device", 1.0)));

            assertThat(assessment.tier()).isEqualTo(RiskTier.MEDIUM);
        }

        @Test
        @DisplayName("should reach HIGH when combined weights pass the high threshold")
        void shouldReachHigh() {
            RiskAssessment assessment = scorer.assess(MODEL, signals(Map.of(
                    "new_device", 1.0,
                    "unusual_location", 0.9,
                    "impossible_travel", 0.6)));

            assertThat(assessment.score()).isEqualTo(140.0);
            assertThat(assessment.tier()).isEqualTo(RiskTier.HIGH);
            assertThat(assessment.contributingSignals())
                    .containsExactly("impossible_travel", "new_device", "unusual_location");
        }
    }

    @Test
    @DisplayName("should never lower the tier when a signal is added")
    void shouldBeMonotonic() {
        Map<String, Double> context = new HashMap<>();
        RiskTier previous = scorer.assess(MODEL, signals(context)).tier();
        for (String signal : new String[]{"unusual_location", "new_device", "impossible_travel"}) {
            context.put(signal, 1.0);
            RiskTier next = scorer.assess(MODEL, signals(context)).tier();
            assertThat(next.compareTo(previous)).isGreaterThanOrEqualTo(0);
            previous = next;
        }
        assertThat(previous).isEqualTo(RiskTier.HIGH);
    }

    @Test
    @DisplayName("should treat low device trust as a risk signal")
    void shouldScoreLowDeviceTrust() {
        RiskModel model = new RiskModel(Map.of("device_trust", 35.0), new RiskThresholds(30, 60, 80));

        RiskAssessment untrusted = scorer.assess(model, RiskContext.builder().deviceTrust(0.2).build());
        RiskAssessment trusted = scorer.assess(model, RiskContext.builder().deviceTrust(0.9).build());

        assertThat(untrusted.score()).isEqualTo(35.0);
        assertThat(trusted.score()).isZero();
    }

    @Test
    @DisplayName("should build the default model from engine properties")
    void shouldBuildDefaultModel() {
        RiskModel model = RiskModel.of(new EngineProperties().getDefaultRiskModel());

        assertThat(model.weights()).containsEntry("new_device", 40.0).hasSize(7);
        assertThat(model.thresholds()).isEqualTo(new RiskThresholds(30, 60, 80));
    }
}
