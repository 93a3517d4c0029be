package com.example.authpolicy.common.exception;

import com.example.authpolicy.policy.exception.AmbiguousPolicyException;
import com.example.authpolicy.policy.exception.IncompleteActionSpecException;
import com.example.authpolicy.policy.exception.NoApplicablePolicyException;
import com.example.authpolicy.policy.exception.PolicyEngineException;
import com.example.authpolicy.policy.exception.PolicyNotFoundException;
import com.example.authpolicy.policy.exception.PolicyValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Every error body carries {@code error}, {@code message} and {@code timestamp}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 200;

    /**
     * Handles rejected policy definitions. The validation errors are returned as-is;
     * they describe the submitted document only.
     */
    @ExceptionHandler(PolicyValidationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handlePolicyValidation(@NonNull PolicyValidationException ex) {
        LOG.warn("Policy validation failed for {}: {} errors",
                sanitizeForLog(ex.getPolicyId()), ex.getResult().errors().size());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("code", ex.getErrorCode());
        response.put("message", "Policy validation failed");
        response.put("details", ex.getResult().errors());
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles admin lookups of unknown policy ids.
     */
    @ExceptionHandler(PolicyNotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handlePolicyNotFound(@NonNull PolicyNotFoundException ex) {
        LOG.warn("Policy not found: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of(
                        "error", "policy_not_found",
                        "code", ex.getErrorCode(),
                        "message", sanitizeResponseMessage(ex.getMessage()),
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles registry contents that cannot be evaluated, including a tenant with no policy in scope
     * under FAIL mode. These need an operator, not a retry.
     */
    @ExceptionHandler({AmbiguousPolicyException.class, IncompleteActionSpecException.class,
            NoApplicablePolicyException.class})
    @NonNull
    public ResponseEntity<Map<String, Object>> handlePolicyConfiguration(@NonNull PolicyEngineException ex) {
        LOG.error("Policy configuration error {}: {}", ex.getErrorCode(), sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "policy_configuration_error",
                        "code", ex.getErrorCode(),
                        "message", sanitizeResponseMessage(ex.getMessage()),
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", error.getDefaultMessage() != null
                                ? sanitizeResponseMessage(error.getDefaultMessage())
                                : "Invalid value"
                ))
                .toList();

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", fieldErrors);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles malformed request body or type conversion errors.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_request",
                        "message", "Invalid request format",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles illegal argument exceptions (unknown enum values, malformed ids).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_argument",
                        "message", sanitizeResponseMessage(ex.getMessage()),
                        "timestamp", Instant.now().toString()
                ));
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "internal_error",
                        "message", "An unexpected error occurred",
                        "timestamp", Instant.now().toString()
                ));
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        // Only allow alphanumeric, dot, brackets and underscore
        String sanitized = fieldName.replaceAll("[^a-zA-Z0-9._\\[\\]]", "");
        return sanitized.substring(0, Math.min(sanitized.length(), 50));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
