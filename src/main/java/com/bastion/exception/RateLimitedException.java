package com.bastion.exception;

import lombok.Getter;

/**
 * Thrown when a provider's admission window stays saturated. Transient.
 */
@Getter
public class RateLimitedException extends GatewayException {

    private final String providerId;
    private final long retryAfterMs;

    public RateLimitedException(String providerId, long retryAfterMs) {
        super("Rate limit exceeded for provider " + providerId + ", retry after " + retryAfterMs + "ms");
        this.providerId = providerId;
        this.retryAfterMs = retryAfterMs;
    }
}
