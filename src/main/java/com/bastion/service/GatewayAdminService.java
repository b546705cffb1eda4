package com.bastion.service;

import com.bastion.model.dto.CacheStatistics;
import com.bastion.model.dto.InvalidationRequest;
import com.bastion.model.dto.InvalidationResult;
import com.bastion.model.dto.ProviderHealthReport;
import com.bastion.repository.CacheStore;
import com.bastion.resilience.CircuitBreakerSnapshot;
import com.bastion.resilience.ProviderHealthRegistry;
import com.bastion.resilience.RateLimitWindow;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Administrative operations across all gateways: invalidation, statistics and provider health.
 */
@Slf4j
public class GatewayAdminService {

    private final Map<String, ResponseCache<?, ?>> cachesByNamespace = new LinkedHashMap<>();
    private final CacheStore store;
    private final CacheStatisticsRecorder statistics;
    private final ProviderHealthRegistry registry;
    private final ProviderGuards guards;

    public GatewayAdminService(List<Gateway<?, ?>> gateways, CacheStore store, CacheStatisticsRecorder statistics,
                               ProviderHealthRegistry registry, ProviderGuards guards) {
        gateways.forEach(gateway -> cachesByNamespace.put(gateway.getCache().getNamespace(), gateway.getCache()));
        this.store = store;
        this.statistics = statistics;
        this.registry = registry;
        this.guards = guards;
    }

    public Mono<InvalidationResult> invalidate(InvalidationRequest request) {
        String namespace = request.getNamespace();
        if (namespace == null || namespace.isBlank()) {
            return clearAll();
        }
        ResponseCache<?, ?> cache = cachesByNamespace.get(namespace);
        if (request.getPattern() == null || request.getPattern().isBlank()) {
            Mono<Long> removed = cache != null ? cache.invalidateNamespace() : store.deleteNamespace(namespace);
            return removed.map(count -> result("namespace:" + namespace, count));
        }
        String pattern = request.getPattern();
        Mono<Long> removed = cache != null ? cache.invalidate(pattern) : store.deleteByPattern(namespace, pattern);
        return removed.map(count -> result("pattern:" + namespace + ":" + pattern, count));
    }

    /**
     * Removes every entry of every namespace and resets the statistics.
     */
    public Mono<InvalidationResult> clearAll() {
        return store.deleteAll()
                .doOnNext(removed -> {
                    statistics.reset();
                    log.info("Cleared all cache entries ({} removed)", removed);
                })
                .map(count -> result("all", count));
    }

    public CacheStatistics getStatistics() {
        return statistics.snapshot();
    }

    public Mono<ProviderHealthReport> checkHealth() {
        return registry.checkHealth()
                .map(records -> {
                    List<GuardedProvider<?, ?, ?>> guarded = guards.all();
                    List<CircuitBreakerSnapshot> circuits = guarded.stream()
                            .map(provider -> provider.getCircuitBreaker().snapshot())
                            .collect(Collectors.toList());
                    Map<String, RateLimitWindow> windows = new LinkedHashMap<>();
                    guarded.forEach(provider -> windows.put(provider.getName(), provider.getRateLimiter().window()));
                    return ProviderHealthReport.builder()
                            .providers(records)
                            .circuits(circuits)
                            .admissionWindows(windows)
                            .build();
                });
    }

    private static InvalidationResult result(String scope, long removed) {
        return InvalidationResult.builder()
                .scope(scope)
                .removed(removed)
                .build();
    }
}
