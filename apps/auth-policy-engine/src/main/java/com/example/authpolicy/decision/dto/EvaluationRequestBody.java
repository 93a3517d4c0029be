package com.example.authpolicy.decision.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record EvaluationRequestBody(
        @NotBlank @Size(max = 128) String tenantId,
        String userType,
        String securityProfile,
        String region,
        String operation,
        List<@Valid EvidenceItem> evidence,
        @Valid RiskContextRequest riskContext
) {
}
