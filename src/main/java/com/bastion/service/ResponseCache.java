package com.bastion.service;

import com.bastion.model.CacheEntry;
import com.bastion.model.CacheableRequest;
import com.bastion.model.GatewayResponse;
import com.bastion.model.OperationKind;
import com.bastion.model.OperationPolicy;
import com.bastion.model.RequestFingerprint;
import com.bastion.repository.CacheStore;
import com.bastion.repository.KeyPattern;
import com.bastion.service.canonicalization.RequestFingerprinter;
import com.bastion.service.cost.CostModel;
import com.bastion.telemetry.GatewayEventListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Cost-aware cache-aside layer of one namespace.
 *
 * <p>Only requests passing the cacheability gate are fingerprinted and looked up. Expiry is
 * enforced at read time against the injected clock, whatever the store does on its own.
 * Store failures are logged and behave like a miss (on read) or a skipped write.
 *
 * @param <Q> request type
 * @param <N> normalized response type
 */
@Slf4j
public class ResponseCache<Q extends CacheableRequest, N> {

    private static final List<String> DYNAMIC_INDICATORS = List.of(
            "/search", "/results", "/api/", "/ajax/",
            "?q=", "?query=", "?search=", "/live", "/real-time"
    );

    @Getter
    private final String namespace;
    private final CacheStore store;
    private final RequestFingerprinter fingerprinter;
    private final CachePolicies policies;
    private final CostModel<Q, N> costModel;
    private final CacheStatisticsRecorder statistics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GatewayEventListener listener;

    public ResponseCache(String namespace, CacheStore store, RequestFingerprinter fingerprinter,
                         CachePolicies policies, CostModel<Q, N> costModel,
                         CacheStatisticsRecorder statistics, ObjectMapper objectMapper,
                         Clock clock, GatewayEventListener listener) {
        this.namespace = namespace;
        this.store = store;
        this.fingerprinter = fingerprinter;
        this.policies = policies;
        this.costModel = costModel;
        this.statistics = statistics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Looks up a live entry for the request.
     *
     * @return the cached response tagged {@code cached=true}, or empty
     */
    public Mono<GatewayResponse<N>> get(Q request, OperationKind operation) {
        return Mono.defer(() -> {
            if (!isCacheable(request, operation)) {
                return Mono.empty();
            }
            String key = fingerprinter.fingerprint(request, operation).cacheKey();
            return store.get(namespace, key)
                    .flatMap(entry -> {
                        if (entry.expiredAt(clock.instant())) {
                            log.debug("Cache entry expired: ns={}, key={}, expiredAt={}",
                                    namespace, key, entry.getExpiresAt());
                            return Mono.empty();
                        }
                        return Mono.just(toHit(key, operation, entry));
                    });
        }).onErrorResume(e -> {
            log.warn("Cache lookup failed for ns={}, treating as miss: {}", namespace, e.getMessage());
            return Mono.empty();
        });
    }

    /**
     * Stores a freshly served response under the operation's TTL.
     *
     * @return whether the response was stored
     */
    public Mono<Boolean> set(Q request, GatewayResponse<N> response, OperationKind operation) {
        return Mono.defer(() -> {
            if (response.getData() == null || !isCacheable(request, operation)) {
                return Mono.just(false);
            }
            OperationPolicy policy = policies.policyFor(operation);
            N data = response.getData();
            long size = costModel.responseSize(data);
            if (size > policy.getMaxOutputSize()) {
                log.debug("Response of {} units exceeds cap {} for {}, not caching",
                        size, policy.getMaxOutputSize(), operation);
                return Mono.just(false);
            }

            RequestFingerprint fingerprint = fingerprinter.fingerprint(request, operation);
            String key = fingerprint.cacheKey();
            BigDecimal cost = costModel.actual(request, data);
            statistics.recordMiss(namespace, cost);
            listener.onCacheMiss(namespace, key, operation, cost);

            Instant createdAt = response.getCreatedAt() != null ? response.getCreatedAt() : clock.instant();
            CacheEntry entry = CacheEntry.builder()
                    .key(key)
                    .namespace(namespace)
                    .operation(operation)
                    .provider(response.getProvider())
                    .value(objectMapper.valueToTree(data))
                    .ttlSeconds(policy.ttlSeconds())
                    .createdAt(createdAt)
                    .costEstimate(cost)
                    .unitsServed(costModel.unitsServed(data))
                    .build();

            return store.set(namespace, key, entry, policy.ttlSeconds())
                    .thenReturn(true);
        }).onErrorResume(e -> {
            log.warn("Cache write failed for ns={}, continuing uncached: {}", namespace, e.getMessage());
            return Mono.just(false);
        });
    }

    /**
     * Removes the namespace's entries whose key matches {@code pattern}.
     */
    public Mono<Long> invalidate(String pattern) {
        return store.deleteByPattern(namespace, pattern)
                .doOnNext(removed -> log.info("Invalidated {} entries in {} matching {}", removed, namespace, pattern));
    }

    public Mono<Long> invalidateNamespace() {
        return store.deleteNamespace(namespace)
                .doOnNext(removed -> log.info("Invalidated namespace {} ({} entries)", namespace, removed));
    }

    /**
     * Whether the request may be served from or stored into the cache at all.
     */
    public boolean isCacheable(Q request, OperationKind operation) {
        OperationPolicy policy = policies.policyFor(operation);
        if (!policy.isEnabled()) {
            return false;
        }
        if (request.streaming()) {
            return false;
        }
        if (request.cacheModel() != null && policy.getExcludedModels().contains(request.cacheModel())) {
            return false;
        }
        String url = request.targetUrl();
        if (url != null) {
            if (policy.getExcludedUrlPatterns().stream().anyMatch(pattern -> KeyPattern.compile(pattern).test(url))) {
                return false;
            }
            if (!policy.isIncludeDynamic() && isDynamicUrl(url)) {
                return false;
            }
        }
        if (costModel.estimate(request).compareTo(policy.getCostThreshold()) < 0) {
            return false;
        }
        return request.requestedOutputSize() <= policy.getMaxOutputSize();
    }

    static boolean isDynamicUrl(String url) {
        return DYNAMIC_INDICATORS.stream().anyMatch(url::contains);
    }

    private GatewayResponse<N> toHit(String key, OperationKind operation, CacheEntry entry) {
        N data = readValue(entry.getValue());
        BigDecimal savings = entry.getCostEstimate() != null ? entry.getCostEstimate() : BigDecimal.ZERO;
        statistics.recordHit(namespace, savings, entry.getUnitsServed());
        listener.onCacheHit(namespace, key, operation, savings);
        return GatewayResponse.<N>builder()
                .data(data)
                .provider(entry.getProvider())
                .cached(true)
                .createdAt(entry.getCreatedAt())
                .cacheKey(key)
                .costEstimate(savings)
                .build();
    }

    private N readValue(JsonNode value) {
        try {
            return objectMapper.treeToValue(value, costModel.responseType());
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable cache entry in " + namespace, e);
        }
    }
}
