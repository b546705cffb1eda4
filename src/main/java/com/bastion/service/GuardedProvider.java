package com.bastion.service;

import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.provider.ProviderAdapter;
import com.bastion.resilience.CircuitBreaker;
import com.bastion.resilience.RateLimiter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A provider adapter behind its own circuit breaker, rate limiter and per-call timeout.
 * The breaker sees one outcome per call, after the limiter's retries are spent.
 */
@Slf4j
@Getter
public class GuardedProvider<Q, P, N> {

    private final ProviderAdapter<Q, P, N> adapter;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    private final Scheduler scheduler;

    public GuardedProvider(ProviderAdapter<Q, P, N> adapter, RateLimiter rateLimiter,
                           CircuitBreaker circuitBreaker, Duration timeout, Scheduler scheduler) {
        this.adapter = adapter;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    public String getName() {
        return adapter.getName();
    }

    public boolean isEnabled() {
        return adapter.isEnabled();
    }

    /**
     * Calls the provider and normalizes its answer.
     */
    public Mono<N> call(Q request) {
        return circuitBreaker.execute(() -> rateLimiter.executeWithRetry(
                () -> attempt(request), RetryClassifier::isRetryable));
    }

    private Mono<N> attempt(Q request) {
        return Mono.defer(() -> adapter.call(request))
                .timeout(timeout, scheduler)
                .switchIfEmpty(Mono.error(() -> new ProviderException(getName(),
                        ProviderErrorType.MALFORMED_RESPONSE, "empty response")))
                .map(adapter::toNormalizedForm)
                .onErrorMap(e -> !(e instanceof ProviderException), this::classify);
    }

    private ProviderException classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return new ProviderException(getName(), ProviderErrorType.TIMEOUT, null,
                    "no answer within " + timeout.toMillis() + "ms", error);
        }
        return new ProviderException(getName(), ProviderErrorType.MALFORMED_RESPONSE, null,
                "could not normalize response: " + error.getMessage(), error);
    }
}
