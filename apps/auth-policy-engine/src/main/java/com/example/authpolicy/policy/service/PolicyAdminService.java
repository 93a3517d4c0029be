package com.example.authpolicy.policy.service;

import com.example.authpolicy.common.util.StringSanitizer;
import com.example.authpolicy.policy.document.PolicyDocument;
import com.example.authpolicy.policy.document.PolicyDocumentMapper;
import com.example.authpolicy.policy.dto.PolicyWriteResponse;
import com.example.authpolicy.policy.exception.PolicyNotFoundException;
import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.model.PolicyType;
import com.example.authpolicy.policy.validation.PolicyValidator;
import com.example.authpolicy.policy.validation.ValidationResult;
import com.example.authpolicy.registry.PolicyFilter;
import com.example.authpolicy.registry.PolicyRegistry;
import com.example.authpolicy.registry.PolicySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Policy lifecycle operations behind the admin API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAdminService {

    private final PolicyRegistry registry;
    private final PolicyValidator validator;
    private final PolicyDocumentMapper mapper;

    /**
     * Validate without storing.
     */
    public Mono<ValidationResult> validate(PolicyDocument document) {
        return Mono.fromCallable(() -> validator.validate(document));
    }

    /**
     * Insert or replace the policy with the given id. The path id wins over an id in the body.
     *
     * @throws PolicyValidationException if the document is invalid
     */
    public Mono<PolicyWriteResponse> put(String policyId, PolicyDocument document) {
        return Mono.fromCallable(() -> {
            if (!StringSanitizer.isValidSafeId(policyId)) {
                throw new IllegalArgumentException("Invalid policy id");
            }
            if (document.id() != null && !document.id().equals(policyId)) {
                throw new IllegalArgumentException("Policy id in body does not match path");
            }
            PolicyDocument withId = withId(document, policyId);

            ValidationResult result = validator.validate(withId);
            if (!result.ok()) {
                log.warn("Rejected policy {}: {} errors", StringSanitizer.forLog(policyId), result.errors().size());
                throw new PolicyValidationException(policyId, result);
            }
            PolicySnapshot snapshot = registry.put(mapper.toPolicy(withId));
            return new PolicyWriteResponse(policyId, true, result.errors(), snapshot.version());
        });
    }

    public Mono<PolicyDocument> get(String policyId) {
        return Mono.fromCallable(() -> registry.get(policyId)
                .map(mapper::toDocument)
                .orElseThrow(() -> PolicyNotFoundException.forId(policyId)));
    }

    public Flux<PolicyDocument> list(@Nullable String tenantId, @Nullable String type, @Nullable Boolean enabled) {
        return Mono.fromCallable(() -> {
                    PolicyType policyType = null;
                    if (type != null) {
                        policyType = PolicyType.fromValue(type)
                                .orElseThrow(() -> new IllegalArgumentException("Unknown policy type: " + type));
                    }
                    return registry.list(new PolicyFilter(tenantId, policyType, enabled));
                })
                .flatMapIterable(policies -> policies)
                .map(mapper::toDocument);
    }

    public Mono<Void> delete(String policyId) {
        return Mono.fromCallable(() -> registry.delete(policyId))
                .flatMap(deleted -> deleted
                        ? Mono.<Void>empty()
                        : Mono.error(PolicyNotFoundException.forId(policyId)));
    }

    private static PolicyDocument withId(PolicyDocument document, String policyId) {
        return new PolicyDocument(policyId, document.tenantId(), document.name(), document.description(),
                document.type(), document.rules(), document.appliesToUserTypes(),
                document.appliesToSecurityProfiles(), document.appliesToRegions(), document.enabled(),
                document.priority());
    }
}
