package com.example.authpolicy.policy.controller;

import com.example.authpolicy.policy.document.PolicyDocument;
import com.example.authpolicy.policy.dto.PolicyWriteResponse;
import com.example.authpolicy.policy.service.PolicyAdminService;
import com.example.authpolicy.policy.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/policies")
@RequiredArgsConstructor
public class PolicyAdminController {

    private final PolicyAdminService policyAdminService;

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidationResult>> validate(@RequestBody PolicyDocument document) {
        return policyAdminService.validate(document)
                .map(result -> result.ok()
                        ? ResponseEntity.ok(result)
                        : ResponseEntity.badRequest().body(result));
    }

    @PutMapping("/{policyId}")
    public Mono<ResponseEntity<PolicyWriteResponse>> put(
            @PathVariable String policyId,
            @RequestBody PolicyDocument document) {
        return policyAdminService.put(policyId, document)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{policyId}")
    public Mono<ResponseEntity<PolicyDocument>> get(@PathVariable String policyId) {
        return policyAdminService.get(policyId)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<PolicyDocument>>> list(
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Boolean enabled) {
        return policyAdminService.list(tenantId, type, enabled)
                .collectList()
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{policyId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String policyId) {
        return policyAdminService.delete(policyId)
                .then(Mono.fromCallable(() -> ResponseEntity.noContent().<Void>build()));
    }
}
