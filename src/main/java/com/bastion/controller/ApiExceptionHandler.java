package com.bastion.controller;

import com.bastion.exception.CacheStoreException;
import com.bastion.exception.NoProvidersAvailableException;
import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.exception.ProviderUnavailableException;
import com.bastion.exception.RateLimitedException;
import com.bastion.model.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps the gateway's typed errors onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex) {
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfterMs() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(new ApiError(HttpStatus.TOO_MANY_REQUESTS.name(), "RATE_LIMITED", ex.getMessage()));
    }

    @ExceptionHandler(NoProvidersAvailableException.class)
    public ResponseEntity<ApiError> handleNoProviders(NoProvidersAvailableException ex) {
        log.warn("No providers available: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(HttpStatus.SERVICE_UNAVAILABLE.name(), "NO_PROVIDERS_AVAILABLE",
                        ex.getMessage(), ex.getAttemptedProviders()));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(ProviderUnavailableException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiError> handleProvider(ProviderException ex) {
        if (ex.getType() == ProviderErrorType.INVALID_REQUEST) {
            return respond(HttpStatus.BAD_REQUEST, ex.getType().name(), ex.getMessage());
        }
        log.warn("Provider error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getType().name(), ex.getMessage());
    }

    @ExceptionHandler(CacheStoreException.class)
    public ResponseEntity<ApiError> handleCacheStore(CacheStoreException ex) {
        log.error("Cache store failure", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CACHE_STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(status.name(), code, message));
    }
}
