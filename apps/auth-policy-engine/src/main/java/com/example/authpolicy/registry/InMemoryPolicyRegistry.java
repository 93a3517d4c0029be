package com.example.authpolicy.registry;

import com.example.authpolicy.policy.exception.PolicyValidationException;
import com.example.authpolicy.policy.model.Policy;
import com.example.authpolicy.policy.validation.PolicyValidator;
import com.example.authpolicy.policy.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copy-on-write registry. Writes are serialized; reads are lock-free.
 */
@Slf4j
public class InMemoryPolicyRegistry implements PolicyRegistry {

    private final PolicyValidator validator;
    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>(PolicySnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();

    public InMemoryPolicyRegistry(PolicyValidator validator) {
        this.validator = validator;
    }

    @Override
    public PolicySnapshot snapshot() {
        return current.get();
    }

    @Override
    public PolicySnapshot put(Policy policy) {
        ValidationResult result = validator.validate(policy);
        if (!result.ok()) {
            log.warn("Rejected policy {}: {}", policy.id(), result.errors());
            throw new PolicyValidationException(policy.id(), result);
        }

        writeLock.lock();
        try {
            PolicySnapshot next = current.get().with(policy);
            current.set(next);
            log.info("Policy {} ({}) stored for tenant {}, registry version {}",
                    policy.id(), policy.type(), policy.tenantId(), next.version());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String policyId) {
        writeLock.lock();
        try {
            PolicySnapshot snapshot = current.get();
            if (snapshot.get(policyId).isEmpty()) {
                return false;
            }
            PolicySnapshot next = snapshot.without(policyId);
            current.set(next);
            log.info("Policy {} deleted, registry version {}", policyId, next.version());
            return true;
        } finally {
            writeLock.unlock();
        }
    }
}
