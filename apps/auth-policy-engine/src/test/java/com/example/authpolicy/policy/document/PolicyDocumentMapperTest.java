package com.example.authpolicy.policy.document;

import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.model.AdaptiveRules;
import com.example.authpolicy.policy.model.MfaRules;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.model.RiskTier;
import com.example.authpolicy.policy.model.StepUpRules;
import com.example.authpolicy.policy.model.StrengthTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.example.authpolicy.util.PolicyDocumentTestBuilder.aDocument;
import static com.example.authpolicy.util.PolicyDocumentTestBuilder.aStepUpDocument;
import static com.example.authpolicy.util.PolicyDocumentTestBuilder.anAdaptiveDocument;
import static com.example.authpolicy.util.PolicyTestBuilder.aPsd2Policy;
import static com.example.authpolicy.util.PolicyTestBuilder.anAdaptivePolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyDocumentMapper")
class PolicyDocumentMapperTest {

    private final PolicyDocumentMapper mapper = new PolicyDocumentMapper();

    @Test
    @DisplayName("should apply defaults for optional fields")
    void shouldApplyDefaults() {
        Policy policy = mapper.toPolicy(aDocument().withMinimumFactorStrength(null).build());

        assertThat(policy.enabled()).isTrue();
        assertThat(policy.priority()).isEqualTo(Policy.DEFAULT_PRIORITY);
        assertThat(policy.rules(MfaRules.class).requirements().minimumFactorStrength())
                .isEqualTo(StrengthTier.BASIC);
    }

    @Test
    @DisplayName("should read step-up rules with fresh authentication required by default")
    void shouldReadStepUpRules() {
        Policy policy = mapper.toPolicy(aStepUpDocument().withType("step_up").withPriority(50).build());

        assertThat(policy.type()).isEqualTo(PolicyType.STEP_UP);
        assertThat(policy.priority()).isEqualTo(50);
        StepUpRules rules = policy.rules(StepUpRules.class);
        assertThat(rules.maxLastFactorAge()).isEqualTo(Duration.ofMinutes(5));
        assertThat(rules.requireFreshAuthentication()).isTrue();
        assertThat(rules.isHighRisk("transaction_approval")).isTrue();
    }

    @Test
    @DisplayName("should key tier actions by risk tier")
    void shouldReadTierActions() {
        AdaptiveRules rules = mapper.toPolicy(anAdaptiveDocument().build()).rules(AdaptiveRules.class);

        assertThat(rules.actions()).containsOnlyKeys(RiskTier.LOW, RiskTier.MEDIUM, RiskTier.HIGH);
        assertThat(rules.actionFor(RiskTier.NONE)).contains(rules.actions().get(RiskTier.LOW));
        assertThat(rules.riskThresholds().tierFor(60)).isEqualTo(RiskTier.MEDIUM);
    }

    @Test
    @DisplayName("should fail strict conversion of an incomplete document")
    void shouldFailStrictConversion() {
        assertThatThrownBy(() -> mapper.toPolicy(aDocument().withoutRules().build()))
                .isInstanceOfSatisfying(PolicyValidationException.class, error -> {
                    assertThat(error.getPolicyId()).isEqualTo("mfa-base");
                    assertThat(error.getResult().errors()).containsExactly("rules is required");
                });
    }

    @Test
    @DisplayName("should write documents that read back to the same policy")
    void shouldWriteReadableDocuments() {
        Policy adaptive = anAdaptivePolicy().build();
        Policy psd2 = aPsd2Policy().build();

        assertThat(mapper.toPolicy(mapper.toDocument(adaptive))).isEqualTo(adaptive);
        assertThat(mapper.toPolicy(mapper.toDocument(psd2))).isEqualTo(psd2);
    }

    @Test
    @DisplayName("should write tier keys in lower case")
    void shouldWriteLowerCaseTierKeys() {
        PolicyDocument document = mapper.toDocument(anAdaptivePolicy().build());

        assertThat(document.type()).isEqualTo("ADAPTIVE");
        assertThat(document.rules().actions()).containsOnlyKeys("low", "medium", "high");
        assertThat(document.rules().requiredFactors()).isNull();
    }
}
