package com.example.authpolicy.config.properties;

import com.example.authpolicy.policy.document.PolicyDocument;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Seed policies. Loaded from config/auth-policies.yml
 */
@ConfigurationProperties(prefix = "app")
public record PolicySeedProperties(List<PolicyDocument> policies) {

    public PolicySeedProperties {
        if (policies == null) {
            policies = List.of();
        }
    }
}
