package com.creditgate.config;

import com.creditgate.gate.SearchProviderException;
import com.creditgate.ledger.AccountNotFoundException;
import com.creditgate.ledger.InsufficientCreditsException;
import com.creditgate.ratelimit.RateLimitBackendException;
import com.creditgate.ratelimit.RateLimitDecision;
import com.creditgate.ratelimit.RateLimitExceededException;
import com.creditgate.security.ExpiredCredentialException;
import com.creditgate.security.ForbiddenCredentialException;
import com.creditgate.security.InvalidCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unhandled exception", ex);
        Map<String, Object> response = body(ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(RateLimitExceededException ex) {
        RateLimitDecision decision = ex.getDecision();
        Map<String, Object> response = body("RateLimitExceeded", "Rate limit exceeded");
        response.put("limit", decision.getLimit());
        response.put("remaining", decision.getRemaining());
        response.put("resetAt", decision.getResetAt().toString());
        response.put("retryAfterSeconds", decision.getRetryAfterSeconds());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("X-RateLimit-Limit", String.valueOf(decision.getLimit()))
                .header("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()))
                .header("X-RateLimit-Reset", String.valueOf(decision.getResetAt().getEpochSecond()))
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()))
                .body(response);
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientCredits(InsufficientCreditsException ex) {
        Map<String, Object> response = body("InsufficientCredits", ex.getMessage());
        response.put("required", ex.getRequired());
        response.put("balance", ex.getBalance());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(response);
    }

    @ExceptionHandler(InvalidCredentialException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCredential(InvalidCredentialException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(body("Unauthorized", ex.getMessage()));
    }

    @ExceptionHandler(ExpiredCredentialException.class)
    public ResponseEntity<Map<String, Object>> handleExpiredCredential(ExpiredCredentialException ex) {
        Map<String, Object> response = body("CredentialExpired", ex.getMessage());
        response.put("expiredAt", ex.getExpiredAt().toString());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"")
                .body(response);
    }

    @ExceptionHandler(ForbiddenCredentialException.class)
    public ResponseEntity<Map<String, Object>> handleForbiddenCredential(ForbiddenCredentialException ex) {
        Map<String, Object> response = body("Forbidden", ex.getMessage());
        if (ex.getRequiredScope() != null) {
            response.put("requiredScope", ex.getRequiredScope());
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAccountNotFound(AccountNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("AccountNotFound", ex.getMessage()));
    }

    @ExceptionHandler(SearchProviderException.class)
    public ResponseEntity<Map<String, Object>> handleSearchProvider(SearchProviderException ex) {
        logger.error("Search provider failed", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(body("UpstreamFailure", "The lookup could not be completed; no credits were charged"));
    }

    @ExceptionHandler(RateLimitBackendException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitBackend(RateLimitBackendException ex) {
        logger.error("Rate limit store unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("RateLimitStoreUnavailable", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body("ValidationError", "Validation failed");
        response.put("errors", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingRequestValueException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("MalformedRequest", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("IllegalArgument", ex.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        response.put("traceId", MDC.get("correlationId"));
        return response;
    }
}
