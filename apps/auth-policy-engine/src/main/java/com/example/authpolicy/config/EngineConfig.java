package com.example.authpolicy.config;

import com.example.authpolicy.config.properties.PolicySeedProperties;
import com.example.authpolicy.policy.document.PolicyDocument;
import com.example.authpolicy.policy.document.PolicyDocumentMapper;
import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.validation.PolicyValidator;
import com.example.authpolicy.policy.validation.ValidationResult;
import com.example.authpolicy.registry.InMemoryPolicyRegistry;
import com.example.authpolicy.registry.PolicyFilter;
import com.example.authpolicy.registry.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Creates the policy registry and publishes the seed policies from YAML configuration.
 * An invalid seed policy fails startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PolicySeedProperties.class)
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PolicyRegistry policyRegistry(
            PolicySeedProperties seeds,
            PolicyValidator validator,
            PolicyDocumentMapper mapper) {

        InMemoryPolicyRegistry registry = new InMemoryPolicyRegistry(validator);
        for (PolicyDocument document : seeds.policies()) {
            ValidationResult result = validator.validate(document);
            if (!result.ok()) {
                log.error("Seed policy {} is invalid: {}", document.id(), result.errors());
                throw new PolicyValidationException(document.id(), result);
            }
            registry.put(mapper.toPolicy(document));
        }

        log.info("Loaded {} authentication policies from configuration", seeds.policies().size());
        registry.list(PolicyFilter.all()).forEach(p ->
                log.debug("  - {} {} (tenant={}, priority={})", p.id(), p.type(), p.tenantId(), p.priority()));
        return registry;
    }
}
