package com.bastion.service;

import com.bastion.exception.ProviderErrorType;
import com.bastion.exception.ProviderException;
import com.bastion.exception.ProviderUnavailableException;
import com.bastion.model.ProviderCategory;
import com.bastion.model.SearchRequest;
import com.bastion.model.SearchResponse;
import com.bastion.resilience.CircuitBreaker;
import com.bastion.resilience.CircuitState;
import com.bastion.resilience.RateLimiter;
import com.bastion.support.MutableClock;
import com.bastion.support.RecordingListener;
import com.bastion.support.StubProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GuardedProvider.
 */
class GuardedProviderTest {

    private static final SearchRequest REQUEST = SearchRequest.builder().query("jep 444").build();

    private VirtualTimeScheduler scheduler;
    private MutableClock clock;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        clock = MutableClock.atEpoch();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void testThrottledCallsAreRetriedBeforeTheBreakerSeesThem() {
        AtomicInteger attempts = new AtomicInteger();
        StubProvider<SearchRequest, SearchResponse, SearchResponse> serper = new StubProvider<>("serper",
                ProviderCategory.SEARCH, request -> attempts.incrementAndGet() <= 2
                ? Mono.error(new ProviderException("serper", ProviderErrorType.RATE_LIMITED, 429, "HTTP 429", null))
                : Mono.just(SearchResponse.builder().query("ok").build()), r -> r);
        GuardedProvider<SearchRequest, SearchResponse, SearchResponse> guarded = guard(serper, 3, 1);

        StepVerifier.withVirtualTime(() -> guarded.call(REQUEST), () -> scheduler, 1)
                .expectSubscription()
                .thenAwait(Duration.ofMillis(300))
                .assertNext(response -> assertEquals("ok", response.getQuery()))
                .verifyComplete();

        assertEquals(3, serper.calls());
        assertEquals(CircuitState.CLOSED, guarded.getCircuitBreaker().currentState());
        assertEquals(0, guarded.getCircuitBreaker().snapshot().getConsecutiveFailures());
    }

    @Test
    void testOpenBreakerShortCircuitsTheAdapter() {
        StubProvider<SearchRequest, SearchResponse, SearchResponse> serper = StubProvider.failing("serper",
                ProviderCategory.SEARCH, new ProviderException("serper", ProviderErrorType.UPSTREAM, "HTTP 500"));
        GuardedProvider<SearchRequest, SearchResponse, SearchResponse> guarded = guard(serper, 3, 1);

        StepVerifier.create(guarded.call(REQUEST)).expectError(ProviderException.class).verify();
        StepVerifier.create(guarded.call(REQUEST)).expectError(ProviderUnavailableException.class).verify();
        assertEquals(1, serper.calls());
    }

    @Test
    void testEmptyAnswerIsMalformed() {
        StubProvider<SearchRequest, SearchResponse, SearchResponse> serper = new StubProvider<>("serper",
                ProviderCategory.SEARCH, request -> Mono.empty(), r -> r);

        StepVerifier.create(guard(serper, 0, 5).call(REQUEST))
                .expectErrorSatisfies(error ->
                        assertEquals(ProviderErrorType.MALFORMED_RESPONSE, ((ProviderException) error).getType()))
                .verify();
    }

    @Test
    void testNormalizationFailureIsMalformed() {
        StubProvider<SearchRequest, String, SearchResponse> serper = new StubProvider<>("serper",
                ProviderCategory.SEARCH, request -> Mono.just("<html>"), raw -> {
                    throw new IllegalStateException("not json");
                });
        GuardedProvider<SearchRequest, String, SearchResponse> guarded = new GuardedProvider<>(serper,
                new RateLimiter("serper", 10, Duration.ofSeconds(1), 0, Duration.ofMillis(100), scheduler, listener),
                new CircuitBreaker("serper", 5, Duration.ofSeconds(60), clock, listener),
                Duration.ofSeconds(5), scheduler);

        StepVerifier.create(guarded.call(REQUEST))
                .expectErrorSatisfies(error -> {
                    ProviderException providerError = (ProviderException) error;
                    assertEquals(ProviderErrorType.MALFORMED_RESPONSE, providerError.getType());
                    assertTrue(providerError.getMessage().contains("not json"));
                })
                .verify();
    }

    private GuardedProvider<SearchRequest, SearchResponse, SearchResponse> guard(
            StubProvider<SearchRequest, SearchResponse, SearchResponse> provider, int maxRetries, int failureThreshold) {
        RateLimiter limiter = new RateLimiter(provider.getName(), 10, Duration.ofSeconds(1), maxRetries,
                Duration.ofMillis(100), scheduler, listener);
        CircuitBreaker breaker = new CircuitBreaker(provider.getName(), failureThreshold, Duration.ofSeconds(60),
                clock, listener);
        return new GuardedProvider<>(provider, limiter, breaker, Duration.ofSeconds(5), scheduler);
    }
}
