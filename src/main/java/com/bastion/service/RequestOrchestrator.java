package com.bastion.service;

import com.bastion.exception.NoProvidersAvailableException;
import com.bastion.exception.ProviderUnavailableException;
import com.bastion.model.GatewayResponse;
import com.bastion.resilience.ProviderHealthRegistry;
import com.bastion.telemetry.GatewayEventListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Serves a route's requests from its primary provider, falling back to the secondary.
 *
 * <p>Providers are tried in declared order, skipping those the health registry has marked
 * down. Every call outcome is reported to the registry. When no provider serves the request
 * the caller gets {@link NoProvidersAvailableException} carrying each failure.
 *
 * @param <Q> request type of the route
 * @param <N> normalized response type of the route
 */
@Slf4j
public class RequestOrchestrator<Q, N> {

    @Getter
    private final String route;
    private final GuardedProvider<Q, ?, N> primary;
    private final GuardedProvider<Q, ?, N> secondary;
    private final ProviderHealthRegistry registry;
    private final GatewayEventListener listener;
    private final Clock clock;

    /**
     * @param secondary may be {@code null} when the route has no fallback
     */
    public RequestOrchestrator(String route, GuardedProvider<Q, ?, N> primary, GuardedProvider<Q, ?, N> secondary,
                               ProviderHealthRegistry registry, GatewayEventListener listener, Clock clock) {
        this.route = route;
        this.primary = primary;
        this.secondary = secondary;
        this.registry = registry;
        this.listener = listener;
        this.clock = clock;
    }

    public Mono<GatewayResponse<N>> execute(Q request) {
        return Mono.defer(() -> {
            List<String> attempted = new ArrayList<>();
            List<Throwable> failures = new ArrayList<>();

            if (!isEligible(primary)) {
                log.warn("Primary provider {} of route {} is unavailable, skipping", primary.getName(), route);
                failures.add(new ProviderUnavailableException(primary.getName(), "marked unavailable"));
                return fallback(request, attempted, failures, failures.get(0));
            }

            attempted.add(primary.getName());
            return attempt(primary, request, false)
                    .onErrorResume(error -> {
                        failures.add(error);
                        return fallback(request, attempted, failures, error);
                    });
        });
    }

    private Mono<GatewayResponse<N>> fallback(Q request, List<String> attempted, List<Throwable> failures,
                                              Throwable cause) {
        if (secondary == null) {
            return Mono.error(new NoProvidersAvailableException(route, attempted, failures));
        }
        if (!isEligible(secondary)) {
            log.warn("Secondary provider {} of route {} is unavailable", secondary.getName(), route);
            failures.add(new ProviderUnavailableException(secondary.getName(), "marked unavailable"));
            return Mono.error(new NoProvidersAvailableException(route, attempted, failures));
        }

        listener.onProviderFallback(route, primary.getName(), secondary.getName(), cause);
        attempted.add(secondary.getName());
        return attempt(secondary, request, true)
                .onErrorMap(error -> {
                    failures.add(error);
                    return new NoProvidersAvailableException(route, attempted, failures);
                });
    }

    private Mono<GatewayResponse<N>> attempt(GuardedProvider<Q, ?, N> provider, Q request, boolean fallback) {
        String providerId = provider.getName();
        long start = clock.millis();
        return provider.call(request)
                .doOnError(error -> {
                    registry.recordFailure(providerId);
                    log.warn("event=provider_failed route={} provider={} fallback={} error={}",
                            route, providerId, fallback, error.getMessage());
                })
                .map(data -> {
                    registry.recordSuccess(providerId);
                    long latencyMs = clock.millis() - start;
                    listener.onProviderServed(route, providerId, fallback, latencyMs);
                    return GatewayResponse.<N>builder()
                            .data(data)
                            .provider(providerId)
                            .fallback(fallback)
                            .cached(false)
                            .createdAt(clock.instant())
                            .build();
                });
    }

    private boolean isEligible(GuardedProvider<Q, ?, N> provider) {
        return provider.isEnabled() && registry.isAvailable(provider.getName());
    }
}
